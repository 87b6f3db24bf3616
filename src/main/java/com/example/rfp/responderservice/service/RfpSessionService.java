package com.example.rfp.responderservice.service;

import com.example.rfp.responderservice.exception.StorageException;
import com.example.rfp.responderservice.model.AnsweredQuestion;
import com.example.rfp.responderservice.model.RfpProcessingResult;
import com.example.rfp.responderservice.model.RfpSession;
import com.example.rfp.responderservice.repo.KeyValueStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Keeps the most recently processed RFP so its answers can be reviewed and edited before export.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RfpSessionService {

    static final String STORAGE_KEY = "rfp_state";

    private final KeyValueStore keyValueStore;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public synchronized RfpSession start(String projectName, String fileName, RfpProcessingResult result) {
        RfpSession session = RfpSession.builder()
                .projectName(projectName != null ? projectName : "")
                .fileName(fileName)
                .questions(new ArrayList<>(result.questions()))
                .summary(result.summary())
                .processedAt(clock.instant())
                .build();
        save(session);
        log.info("Saved RFP session for {} with {} questions", fileName, session.getQuestions().size());
        return session;
    }

    public synchronized Optional<RfpSession> current() {
        Optional<byte[]> stored = keyValueStore.get(STORAGE_KEY);
        if (stored.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(stored.get(), RfpSession.class));
        } catch (IOException e) {
            log.warn("Stored RFP session is unreadable, ignoring it: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * @throws NoSuchElementException if there is no session or no question with that ordinal
     */
    public synchronized AnsweredQuestion editAnswer(int index, String answer) {
        RfpSession session = require();
        AnsweredQuestion question = find(session, index);
        question.setEditedAnswer(answer);
        save(session);
        return question;
    }

    public synchronized AnsweredQuestion replaceQuestion(AnsweredQuestion updated) {
        RfpSession session = require();
        AnsweredQuestion existing = find(session, updated.getIndex());
        session.getQuestions().set(session.getQuestions().indexOf(existing), updated);
        save(session);
        return updated;
    }

    public synchronized void clear() {
        keyValueStore.delete(STORAGE_KEY);
    }

    public synchronized RfpSession require() {
        return current().orElseThrow(() -> new NoSuchElementException("No RFP has been processed yet"));
    }

    private static AnsweredQuestion find(RfpSession session, int index) {
        return session.getQuestions().stream()
                .filter(q -> q.getIndex() == index)
                .findFirst()
                .orElseThrow(() -> new NoSuchElementException("No question with index " + index));
    }

    private void save(RfpSession session) {
        try {
            keyValueStore.set(STORAGE_KEY, objectMapper.writeValueAsBytes(session));
        } catch (IOException e) {
            throw new StorageException("Failed to serialize RFP session", e);
        }
    }
}
