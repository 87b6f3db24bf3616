package com.example.rfp.responderservice.model;

import com.example.rfp.responderservice.exception.UnsupportedFileTypeException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentKindTest {

    @Test
    void resolvesByExtensionIgnoringCase() {
        assertThat(DocumentKind.fromFileName("Proposal.PDF")).isEqualTo(DocumentKind.PDF);
        assertThat(DocumentKind.fromFileName("answers.docx")).isEqualTo(DocumentKind.DOCX);
        assertThat(DocumentKind.fromFileName("notes.txt")).isEqualTo(DocumentKind.TXT);
    }

    @Test
    void rejectsOtherFormats() {
        assertThatThrownBy(() -> DocumentKind.fromFileName("legacy.doc"))
                .isInstanceOf(UnsupportedFileTypeException.class)
                .hasMessageContaining("legacy.doc");
        assertThatThrownBy(() -> DocumentKind.fromFileName(null))
                .isInstanceOf(UnsupportedFileTypeException.class);
    }
}
