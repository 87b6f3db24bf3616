package com.example.rfp.responderservice.service;

import com.example.rfp.responderservice.exception.TextExtractionException;
import com.example.rfp.responderservice.model.DocumentKind;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Plain text from uploaded documents, line breaks preserved.
 */
@Slf4j
@Service
public class TextExtractionService {

    public String extractText(byte[] content, DocumentKind kind) {
        try {
            String text = switch (kind) {
                case PDF -> extractPdfText(content);
                case DOCX -> extractDocxText(content);
                case TXT -> new String(content, StandardCharsets.UTF_8);
            };
            log.info("Extracted {} characters from {} document", text.length(), kind);
            return text;
        } catch (IOException e) {
            throw new TextExtractionException("Could not read " + kind + " document: " + e.getMessage(), e);
        }
    }

    /**
     * Extract text from PDF
     */
    private String extractPdfText(byte[] content) throws IOException {
        try (PDDocument document = Loader.loadPDF(content)) {
            PDFTextStripper stripper = new PDFTextStripper();
            return stripper.getText(document);
        }
    }

    /**
     * Extract text from .docx, one paragraph per line
     */
    private String extractDocxText(byte[] content) throws IOException {
        try (ByteArrayInputStream bis = new ByteArrayInputStream(content);
             XWPFDocument document = new XWPFDocument(bis)) {
            StringBuilder text = new StringBuilder();
            for (XWPFParagraph paragraph : document.getParagraphs()) {
                text.append(paragraph.getText()).append("\n");
            }
            return text.toString();
        }
    }
}
