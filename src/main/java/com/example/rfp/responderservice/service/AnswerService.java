// src/main/java/com/example/rfp/responderservice/service/AnswerService.java
package com.example.rfp.responderservice.service;

import com.example.rfp.responderservice.ai.CompletionProvider;
import com.example.rfp.responderservice.exception.CompletionUnavailableException;
import com.example.rfp.responderservice.model.AnsweredQuestion;
import com.example.rfp.responderservice.model.RetrievedMatch;
import com.example.rfp.responderservice.util.VectorMath;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class AnswerService {

    static final String NO_CONTEXT = "No relevant context available in the knowledgebase.";

    private final CompletionProvider completionProvider;

    /**
     * RAG answer: the question plus the retrieved chunk texts, one completion call.
     *
     * @throws CompletionUnavailableException if the completion provider fails
     */
    public String generateAnswer(String question, List<RetrievedMatch> matches) {
        return complete(buildAnswerPrompt(question, matches));
    }

    /**
     * Executive summary over every question and its current answer.
     *
     * @throws CompletionUnavailableException if the completion provider fails
     */
    public String generateSummary(List<AnsweredQuestion> questions) {
        return complete(buildSummaryPrompt(questions));
    }

    public static double confidence(List<RetrievedMatch> matches) {
        return VectorMath.mean(matches.stream().mapToDouble(RetrievedMatch::score).toArray());
    }

    public static String fallbackSummary(int questionCount) {
        return String.format("""
                Thank you for the opportunity to respond to this Request for Proposal. \
                We have carefully reviewed all %d questions and have provided \
                comprehensive responses that demonstrate our capabilities and commitment to \
                delivering exceptional results. We look forward to discussing our proposal \
                in further detail.""", questionCount);
    }

    String buildAnswerPrompt(String question, List<RetrievedMatch> matches) {
        String context = matches.isEmpty()
                ? NO_CONTEXT
                : matches.stream().map(RetrievedMatch::chunkText).collect(Collectors.joining("\n\n"));
        return String.format("""
            You are an expert RFP response writer. Based on the following context from our knowledge base,
            provide a professional, accurate, and comprehensive answer to the question.

            CONTEXT:
            %s

            QUESTION:
            %s

            Provide a clear, professional response suitable for an RFP submission.
            If the context doesn't contain enough information, indicate what additional details might be needed.
            """, context, question);
    }

    String buildSummaryPrompt(List<AnsweredQuestion> questions) {
        String qa = questions.stream()
                .map(q -> "Q: " + q.getQuestionText() + "\nA: " + q.answerText())
                .collect(Collectors.joining("\n\n"));
        return String.format("""
            You are an expert RFP response writer. Based on the following questions and answers
            from an RFP response, write a professional executive summary that:

            1. Introduces the responding organization's capabilities
            2. Highlights key strengths demonstrated in the responses
            3. Expresses enthusiasm for the opportunity
            4. Is concise (2-3 paragraphs maximum)

            QUESTIONS AND ANSWERS:
            %s

            Write the executive summary now:
            """, qa);
    }

    private String complete(String prompt) {
        try {
            return completionProvider.complete(prompt);
        } catch (CompletionUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CompletionUnavailableException("Completion request failed: " + e.getMessage(), e);
        }
    }
}
