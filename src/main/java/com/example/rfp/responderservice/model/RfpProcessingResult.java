package com.example.rfp.responderservice.model;

import java.util.List;

/**
 * Outcome of one RFP run. {@code cancelled} is set when the caller stopped the run before
 * every detected question was started; {@code questions} then holds only the settled ones.
 */
public record RfpProcessingResult(List<AnsweredQuestion> questions, String summary, boolean cancelled) {

    public static RfpProcessingResult empty() {
        return new RfpProcessingResult(List.of(), "", false);
    }
}
