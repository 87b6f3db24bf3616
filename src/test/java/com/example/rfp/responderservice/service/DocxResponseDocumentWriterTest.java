package com.example.rfp.responderservice.service;

import com.example.rfp.responderservice.model.ResponseDocument;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DocxResponseDocumentWriterTest {

    private final DocxResponseDocumentWriter writer = new DocxResponseDocumentWriter(ZoneOffset.UTC);

    @Test
    void writesTitleSummaryAndNumberedQuestions() throws Exception {
        ResponseDocument doc = new ResponseDocument("RFP Response", TestFixtures.CLOCK.instant(),
                "We are delighted to respond.",
                List.of(new ResponseDocument.Item(1, "What is your SLA?", "99.95% uptime."),
                        new ResponseDocument.Item(2, "Who is the contact?", "Jane Doe\nHead of Sales")));

        List<String> paragraphs = read(writer.write(doc));

        assertThat(paragraphs).contains(
                "RFP Response",
                "Generated: March 02, 2026",
                "Executive Summary",
                "We are delighted to respond.",
                "Questions and Responses",
                "Q1: What is your SLA?",
                "99.95% uptime.",
                "Q2: Who is the contact?");
        assertThat(paragraphs).anySatisfy(p -> assertThat(p).contains("Jane Doe").contains("Head of Sales"));
        assertThat(paragraphs.indexOf("Executive Summary")).isLessThan(paragraphs.indexOf("Q1: What is your SLA?"));
        assertThat(paragraphs.get(paragraphs.size() - 1))
                .startsWith("Document generated on Monday, March 02, 2026");
    }

    @Test
    void emptyQuestionListStillProducesDocument() throws Exception {
        ResponseDocument doc = new ResponseDocument("RFP Response", TestFixtures.CLOCK.instant(), "", List.of());

        assertThat(read(writer.write(doc))).contains("Questions and Responses").noneMatch(p -> p.startsWith("Q1:"));
        assertThat(writer.fileExtension()).isEqualTo(".docx");
    }

    private static List<String> read(byte[] bytes) throws Exception {
        try (XWPFDocument doc = new XWPFDocument(new ByteArrayInputStream(bytes))) {
            return doc.getParagraphs().stream().map(XWPFParagraph::getText).toList();
        }
    }
}
