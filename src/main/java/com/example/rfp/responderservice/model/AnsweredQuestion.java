package com.example.rfp.responderservice.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data @Builder @NoArgsConstructor @AllArgsConstructor
public class AnsweredQuestion {
    private int index;                       // 1-based, detection order
    private String questionText;
    private float[] embedding;
    private String generatedAnswer;
    private String editedAnswer;             // what the reviewer sees and changes
    @Builder.Default
    private List<RetrievedMatch> context = new ArrayList<>();
    private double confidenceScore;          // mean context score
    @Builder.Default
    private ProcessingStatus status = ProcessingStatus.PENDING;

    /**
     * The edited answer when the reviewer left one, otherwise the generated answer, never null.
     */
    public String answerText() {
        if (editedAnswer != null && !editedAnswer.isEmpty()) {
            return editedAnswer;
        }
        return generatedAnswer != null ? generatedAnswer : "";
    }

    @JsonIgnore
    public boolean isSettled() {
        return status == ProcessingStatus.COMPLETED || status == ProcessingStatus.FAILED;
    }
}
