package com.example.rfp.responderservice.service;

import com.example.rfp.responderservice.exception.DocumentGenerationException;
import com.example.rfp.responderservice.model.ResponseDocument;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.ParagraphAlignment;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Word layout: title block, executive summary, then each question with its answer.
 */
@Slf4j
@Component
public class DocxResponseDocumentWriter implements ResponseDocumentWriter {

    private static final String FONT = "Calibri";
    private static final String TITLE_COLOR = "00008B";
    private static final String QUESTION_COLOR = "0000FF";
    private static final String GRAY_COLOR = "808080";
    private static final String RULE = "─".repeat(68);

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("MMMM dd, yyyy", Locale.US);
    private static final DateTimeFormatter DATE_TIME =
            DateTimeFormatter.ofPattern("EEEE, MMMM dd, yyyy h:mm a", Locale.US);

    private final ZoneId zone;

    public DocxResponseDocumentWriter() {
        this(ZoneId.systemDefault());
    }

    DocxResponseDocumentWriter(ZoneId zone) {
        this.zone = zone;
    }

    @Override
    public String contentType() {
        return "application/vnd.openxmlformats-officedocument.wordprocessingml.document";
    }

    @Override
    public String fileExtension() {
        return ".docx";
    }

    @Override
    public byte[] write(ResponseDocument document) {
        try (XWPFDocument doc = new XWPFDocument();
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            var generated = document.generatedAt().atZone(zone);

            paragraph(doc, document.title(), 24, true, false, TITLE_COLOR, ParagraphAlignment.CENTER, 0);
            paragraph(doc, "Generated: " + DATE.format(generated), 12, false, true, GRAY_COLOR, ParagraphAlignment.CENTER, 0);
            doc.createParagraph();
            paragraph(doc, RULE, 8, false, false, GRAY_COLOR, ParagraphAlignment.CENTER, 0);
            doc.createParagraph();

            paragraph(doc, "Executive Summary", 16, true, false, TITLE_COLOR, ParagraphAlignment.LEFT, 200);
            paragraph(doc, document.summary(), 11, false, false, null, ParagraphAlignment.LEFT, 300);
            doc.createParagraph();

            paragraph(doc, "Questions and Responses", 16, true, false, TITLE_COLOR, ParagraphAlignment.LEFT, 300);
            for (ResponseDocument.Item item : document.items()) {
                paragraph(doc, "Q" + item.index() + ": " + item.question(), 12, true, false, QUESTION_COLOR,
                        ParagraphAlignment.LEFT, 100);
                paragraph(doc, item.answer(), 11, false, false, null, ParagraphAlignment.LEFT, 400);
            }

            doc.createParagraph();
            paragraph(doc, "Document generated on " + DATE_TIME.format(generated), 9, false, true, GRAY_COLOR,
                    ParagraphAlignment.RIGHT, 0);

            doc.write(out);
            log.info("Generated response document with {} questions", document.items().size());
            return out.toByteArray();
        } catch (IOException e) {
            throw new DocumentGenerationException("Failed to generate document: " + e.getMessage(), e);
        }
    }

    private static void paragraph(XWPFDocument doc, String text, int fontSize, boolean bold, boolean italic,
                                  String color, ParagraphAlignment alignment, int spacingAfterTwips) {
        XWPFParagraph p = doc.createParagraph();
        p.setAlignment(alignment);
        if (spacingAfterTwips > 0) {
            p.setSpacingAfter(spacingAfterTwips);
        }
        XWPFRun run = p.createRun();
        run.setFontFamily(FONT);
        run.setFontSize(fontSize);
        run.setBold(bold);
        run.setItalic(italic);
        if (color != null) {
            run.setColor(color);
        }
        // runs do not honour '\n'; emit explicit breaks
        String[] lines = (text == null ? "" : text).split("\\r?\\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) run.addBreak();
            run.setText(lines[i], i);
        }
    }
}
