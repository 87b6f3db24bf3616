package com.example.rfp.responderservice.service;

import com.example.rfp.responderservice.model.AnsweredQuestion;
import com.example.rfp.responderservice.model.ResponseDocument;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the writer-independent response model. No I/O; the timestamp comes from the clock.
 */
@Component
@RequiredArgsConstructor
public class ResponseAssembler {

    static final String TITLE = "RFP Response";

    private final Clock clock;

    /**
     * @throws IllegalArgumentException if a question has not settled or ordinals are not 1..n
     */
    public ResponseDocument assemble(List<AnsweredQuestion> questions, String summary) {
        List<ResponseDocument.Item> items = new ArrayList<>(questions.size());
        for (int i = 0; i < questions.size(); i++) {
            AnsweredQuestion q = questions.get(i);
            if (!q.isSettled()) {
                throw new IllegalArgumentException("Question " + q.getIndex() + " is still " + q.getStatus());
            }
            if (q.getIndex() != i + 1) {
                throw new IllegalArgumentException(
                        "Question ordinals must run from 1 without gaps, found " + q.getIndex() + " at position " + (i + 1));
            }
            String text = q.getQuestionText() != null ? q.getQuestionText() : "";
            items.add(new ResponseDocument.Item(q.getIndex(), text, q.answerText()));
        }
        return new ResponseDocument(TITLE, clock.instant(), summary != null ? summary : "", List.copyOf(items));
    }
}
