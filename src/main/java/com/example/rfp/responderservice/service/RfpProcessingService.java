package com.example.rfp.responderservice.service;

import com.example.rfp.responderservice.ai.EmbeddingProvider;
import com.example.rfp.responderservice.exception.DimensionMismatchException;
import com.example.rfp.responderservice.exception.EmbeddingUnavailableException;
import com.example.rfp.responderservice.model.AnsweredQuestion;
import com.example.rfp.responderservice.model.DocumentKind;
import com.example.rfp.responderservice.model.ProcessingProgress;
import com.example.rfp.responderservice.model.ProcessingStatus;
import com.example.rfp.responderservice.model.RetrievedMatch;
import com.example.rfp.responderservice.model.RfpProcessingResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Drives an RFP from extracted text to drafted answers and an executive summary.
 *
 * <p>Questions run one at a time in detection order. A provider failure marks only that
 * question as {@link ProcessingStatus#FAILED} with a readable notice; the batch continues.
 * An embedding dimension mismatch is a configuration error and aborts the run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RfpProcessingService {

    static final int TOTAL_STEPS = 6;
    static final String FAILURE_PREFIX = "Unable to generate answer: ";

    private final TextExtractionService textExtractionService;
    private final QuestionDetector questionDetector;
    private final EmbeddingProvider embeddingProvider;
    private final VectorSearchService vectorSearchService;
    private final AnswerService answerService;

    public RfpProcessingResult processFile(String fileName,
                                          byte[] content,
                                          Consumer<ProcessingProgress> progress,
                                          BooleanSupplier cancelled) {
        DocumentKind kind = DocumentKind.fromFileName(fileName);
        progress.accept(ProcessingProgress.inProgress("Uploading", 0, TOTAL_STEPS,
                "File " + fileName + " uploaded successfully."));
        progress.accept(ProcessingProgress.inProgress("Extracting Text", 1, TOTAL_STEPS,
                "Processing " + fileName + "..."));
        String text = textExtractionService.extractText(content, kind);
        return process(text, progress, cancelled);
    }

    public RfpProcessingResult process(String text,
                                      Consumer<ProcessingProgress> progress,
                                      BooleanSupplier cancelled) {
        progress.accept(ProcessingProgress.inProgress("Detecting Questions", 2, TOTAL_STEPS,
                "Analyzing document for questions..."));
        List<String> detected = questionDetector.detect(text);
        if (detected.isEmpty()) {
            log.info("No questions detected");
            progress.accept(ProcessingProgress.completed(TOTAL_STEPS, "No questions detected in the document."));
            return RfpProcessingResult.empty();
        }
        log.info("Detected {} questions", detected.size());

        List<AnsweredQuestion> pending = new ArrayList<>(detected.size());
        for (int i = 0; i < detected.size(); i++) {
            pending.add(AnsweredQuestion.builder()
                    .index(i + 1)
                    .questionText(detected.get(i))
                    .status(ProcessingStatus.PENDING)
                    .build());
        }

        List<AnsweredQuestion> settled = new ArrayList<>(pending.size());
        for (AnsweredQuestion question : pending) {
            if (cancelled.getAsBoolean()) {
                log.info("Processing cancelled after {} of {} questions", settled.size(), pending.size());
                break;
            }
            answer(question, pending.size(), progress);
            settled.add(question);
        }
        boolean wasCancelled = settled.size() < pending.size();

        String summary = wasCancelled
                ? AnswerService.fallbackSummary(settled.size())
                : summarize(settled, progress);

        long failed = settled.stream().filter(q -> q.getStatus() == ProcessingStatus.FAILED).count();
        progress.accept(ProcessingProgress.completed(TOTAL_STEPS, wasCancelled
                ? "Cancelled after " + settled.size() + " of " + pending.size() + " questions."
                : "Processed " + settled.size() + " questions (" + failed + " failed)."));
        return new RfpProcessingResult(List.copyOf(settled), summary, wasCancelled);
    }

    /**
     * Re-runs the pipeline for a single question, keeping its ordinal.
     */
    public AnsweredQuestion regenerate(int index, String questionText) {
        AnsweredQuestion question = AnsweredQuestion.builder()
                .index(index)
                .questionText(questionText)
                .build();
        answer(question, 1, p -> { });
        return question;
    }

    private void answer(AnsweredQuestion question, int total, Consumer<ProcessingProgress> progress) {
        int n = question.getIndex();
        question.setStatus(ProcessingStatus.IN_PROGRESS);
        try {
            progress.accept(ProcessingProgress.inProgress("Generating Embeddings", 3, TOTAL_STEPS,
                    "Embedding question " + n + " of " + total + "..."));
            question.setEmbedding(embed(question.getQuestionText()));

            progress.accept(ProcessingProgress.inProgress("Retrieving Context", 4, TOTAL_STEPS,
                    "Finding relevant context for question " + n + " of " + total + "..."));
            List<RetrievedMatch> matches = vectorSearchService.retrieve(question.getEmbedding());
            question.setContext(new ArrayList<>(matches));
            question.setConfidenceScore(AnswerService.confidence(matches));

            progress.accept(ProcessingProgress.inProgress("Generating Answers", 5, TOTAL_STEPS,
                    "Generating answer for question " + n + " of " + total + "..."));
            String answer = answerService.generateAnswer(question.getQuestionText(), matches);
            question.setGeneratedAnswer(answer);
            question.setEditedAnswer(answer);
            question.setStatus(ProcessingStatus.COMPLETED);
        } catch (DimensionMismatchException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Question {} failed: {}", n, e.getMessage());
            String notice = FAILURE_PREFIX + reason(e);
            question.setGeneratedAnswer(notice);
            question.setEditedAnswer(notice);
            question.setStatus(ProcessingStatus.FAILED);
        }
    }

    private String summarize(List<AnsweredQuestion> questions, Consumer<ProcessingProgress> progress) {
        progress.accept(ProcessingProgress.inProgress("Generating Summary", 5, TOTAL_STEPS,
                "Writing executive summary..."));
        try {
            return answerService.generateSummary(questions);
        } catch (RuntimeException e) {
            log.warn("Summary generation failed, using fallback: {}", e.getMessage());
            return AnswerService.fallbackSummary(questions.size());
        }
    }

    private float[] embed(String text) {
        float[] vector;
        try {
            vector = embeddingProvider.embed(text);
        } catch (EmbeddingUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EmbeddingUnavailableException("Embedding request failed: " + e.getMessage(), e);
        }
        if (vector == null) {
            throw new EmbeddingUnavailableException("Embedding provider returned no vector");
        }
        return vector;
    }

    private static String reason(Exception e) {
        return e.getMessage() != null && !e.getMessage().isBlank() ? e.getMessage() : e.getClass().getSimpleName();
    }
}
