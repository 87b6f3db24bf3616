package com.example.rfp.responderservice.model;

import com.example.rfp.responderservice.exception.UnsupportedFileTypeException;

import java.util.Locale;

public enum DocumentKind {
    PDF(".pdf"),
    DOCX(".docx"),
    TXT(".txt");

    private final String extension;

    DocumentKind(String extension) {
        this.extension = extension;
    }

    public static DocumentKind fromFileName(String fileName) {
        if (fileName != null) {
            String lower = fileName.toLowerCase(Locale.ROOT);
            for (DocumentKind kind : values()) {
                if (lower.endsWith(kind.extension)) {
                    return kind;
                }
            }
        }
        throw new UnsupportedFileTypeException(fileName);
    }
}
