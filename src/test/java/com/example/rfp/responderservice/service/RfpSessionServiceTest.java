package com.example.rfp.responderservice.service;

import com.example.rfp.responderservice.model.AnsweredQuestion;
import com.example.rfp.responderservice.model.ProcessingStatus;
import com.example.rfp.responderservice.model.RetrievedMatch;
import com.example.rfp.responderservice.model.RfpProcessingResult;
import com.example.rfp.responderservice.model.RfpSession;
import com.example.rfp.responderservice.repo.InMemoryKeyValueStore;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RfpSessionServiceTest {

    private final InMemoryKeyValueStore kv = new InMemoryKeyValueStore();
    private final RfpSessionService service =
            new RfpSessionService(kv, TestFixtures.objectMapper(), TestFixtures.CLOCK);

    @Test
    void sessionSurvivesRoundTrip() {
        service.start("Acme RFP", "acme.pdf", result());

        RfpSession session = new RfpSessionService(kv, TestFixtures.objectMapper(), TestFixtures.CLOCK).require();

        assertThat(session.getProjectName()).isEqualTo("Acme RFP");
        assertThat(session.getFileName()).isEqualTo("acme.pdf");
        assertThat(session.getSummary()).isEqualTo("Summary");
        assertThat(session.getProcessedAt()).isEqualTo(TestFixtures.CLOCK.instant());
        assertThat(session.getQuestions()).hasSize(2);
        AnsweredQuestion first = session.getQuestions().get(0);
        assertThat(first.getEmbedding()).containsExactly(1f, 0f);
        assertThat(first.getContext()).containsExactly(new RetrievedMatch("c1", "ctx", 0.8, "kb.txt"));
        assertThat(first.getStatus()).isEqualTo(ProcessingStatus.COMPLETED);
    }

    @Test
    void editAnswerKeepsGeneratedAnswer() {
        service.start("p", "f.txt", result());

        service.editAnswer(2, "Reviewed answer");

        AnsweredQuestion second = service.require().getQuestions().get(1);
        assertThat(second.getEditedAnswer()).isEqualTo("Reviewed answer");
        assertThat(second.getGeneratedAnswer()).isEqualTo("Generated 2");
        assertThat(second.answerText()).isEqualTo("Reviewed answer");
    }

    @Test
    void replaceQuestionSwapsByOrdinal() {
        service.start("p", "f.txt", result());
        AnsweredQuestion fresh = AnsweredQuestion.builder().index(1).questionText("What is Q1?")
                .generatedAnswer("New").editedAnswer("New").status(ProcessingStatus.COMPLETED).build();

        service.replaceQuestion(fresh);

        assertThat(service.require().getQuestions()).extracting(AnsweredQuestion::answerText)
                .containsExactly("New", "Generated 2");
    }

    @Test
    void unknownOrdinalAndMissingSessionAreNotFound() {
        assertThatThrownBy(service::require).isInstanceOf(NoSuchElementException.class);

        service.start("p", "f.txt", result());
        assertThatThrownBy(() -> service.editAnswer(9, "x")).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void clearAndUnreadableStateYieldNoSession() {
        service.start("p", "f.txt", result());
        service.clear();
        assertThat(service.current()).isEmpty();

        kv.set(RfpSessionService.STORAGE_KEY, "[broken".getBytes(StandardCharsets.UTF_8));
        assertThat(service.current()).isEmpty();
    }

    private static RfpProcessingResult result() {
        return new RfpProcessingResult(List.of(
                AnsweredQuestion.builder().index(1).questionText("What is Q1?")
                        .embedding(new float[]{1f, 0f})
                        .generatedAnswer("Generated 1").editedAnswer("Generated 1")
                        .context(List.of(new RetrievedMatch("c1", "ctx", 0.8, "kb.txt")))
                        .confidenceScore(0.8)
                        .status(ProcessingStatus.COMPLETED).build(),
                AnsweredQuestion.builder().index(2).questionText("What is Q2?")
                        .generatedAnswer("Generated 2").editedAnswer("Generated 2")
                        .status(ProcessingStatus.COMPLETED).build()),
                "Summary", false);
    }
}
