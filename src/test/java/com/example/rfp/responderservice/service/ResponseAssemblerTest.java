package com.example.rfp.responderservice.service;

import com.example.rfp.responderservice.model.AnsweredQuestion;
import com.example.rfp.responderservice.model.ProcessingStatus;
import com.example.rfp.responderservice.model.ResponseDocument;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResponseAssemblerTest {

    private final ResponseAssembler assembler = new ResponseAssembler(TestFixtures.CLOCK);

    @Test
    void prefersEditedAnswerAndKeepsOrder() {
        List<AnsweredQuestion> questions = List.of(
                question(1, "What is your SLA?", "99.9%", "99.95% uptime", ProcessingStatus.COMPLETED),
                question(2, "Who is the contact?", "Jane Doe", null, ProcessingStatus.COMPLETED),
                question(3, "Why you?", null, null, ProcessingStatus.FAILED));

        ResponseDocument doc = assembler.assemble(questions, "Summary text");

        assertThat(doc.title()).isEqualTo("RFP Response");
        assertThat(doc.generatedAt()).isEqualTo(TestFixtures.CLOCK.instant());
        assertThat(doc.summary()).isEqualTo("Summary text");
        assertThat(doc.items()).containsExactly(
                new ResponseDocument.Item(1, "What is your SLA?", "99.95% uptime"),
                new ResponseDocument.Item(2, "Who is the contact?", "Jane Doe"),
                new ResponseDocument.Item(3, "Why you?", ""));
    }

    @Test
    void missingSummaryBecomesEmpty() {
        assertThat(assembler.assemble(List.of(), null).summary()).isEmpty();
    }

    @Test
    void rejectsUnsettledQuestions() {
        List<AnsweredQuestion> questions = List.of(
                question(1, "Q?", "a", null, ProcessingStatus.IN_PROGRESS));

        assertThatThrownBy(() -> assembler.assemble(questions, ""))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("IN_PROGRESS");
    }

    @Test
    void rejectsOrdinalGaps() {
        List<AnsweredQuestion> questions = List.of(
                question(1, "Q1?", "a", null, ProcessingStatus.COMPLETED),
                question(3, "Q3?", "b", null, ProcessingStatus.COMPLETED));

        assertThatThrownBy(() -> assembler.assemble(questions, ""))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static AnsweredQuestion question(int index, String text, String generated, String edited,
                                             ProcessingStatus status) {
        return AnsweredQuestion.builder()
                .index(index)
                .questionText(text)
                .generatedAnswer(generated)
                .editedAnswer(edited)
                .status(status)
                .build();
    }
}
