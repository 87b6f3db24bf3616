package com.example.rfp.responderservice.dto;

import com.example.rfp.responderservice.model.AnsweredQuestion;
import com.example.rfp.responderservice.model.ProcessingStatus;
import com.example.rfp.responderservice.model.RetrievedMatch;
import com.example.rfp.responderservice.model.RfpSession;

import java.time.Instant;
import java.util.List;

public record RfpSessionResponse(
        String projectName,
        String fileName,
        Instant processedAt,
        String summary,
        List<Question> questions
) {
    public record Question(
            int index,
            String question,
            String generatedAnswer,
            String answer,
            double confidence,
            ProcessingStatus status,
            List<RetrievedMatch> context
    ) {
        public static Question from(AnsweredQuestion q) {
            return new Question(q.getIndex(), q.getQuestionText(), q.getGeneratedAnswer(), q.answerText(),
                    q.getConfidenceScore(), q.getStatus(),
                    q.getContext() != null ? List.copyOf(q.getContext()) : List.of());
        }
    }

    public static RfpSessionResponse from(RfpSession s) {
        return new RfpSessionResponse(s.getProjectName(), s.getFileName(), s.getProcessedAt(), s.getSummary(),
                s.getQuestions().stream().map(Question::from).toList());
    }
}
