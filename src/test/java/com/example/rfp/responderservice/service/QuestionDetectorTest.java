package com.example.rfp.responderservice.service;

import com.example.rfp.responderservice.config.DetectionProperties;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class QuestionDetectorTest {

    private final QuestionDetector detector = TestFixtures.questionDetector();

    @Test
    void detectsSingleQuestion() {
        assertThat(detector.detect("What is your experience?")).containsExactly("What is your experience?");
    }

    @Test
    void splitsNumberedQuestionsOnOneLine() {
        assertThat(detector.detect("1. What services do you offer? 2. How much does it cost?"))
                .containsExactly("What services do you offer?", "How much does it cost?");
        assertThat(detector.detect("1. What services do you offer?\n2. How much does it cost?"))
                .containsExactly("What services do you offer?", "How much does it cost?");
    }

    @Test
    void ignoresCandidatesBelowMinimumLength() {
        assertThat(detector.detect("Yes?")).isEmpty();

        DetectionProperties lenient = new DetectionProperties();
        lenient.setMinLength(3);
        assertThat(new QuestionDetector(lenient).detect("Yes?")).containsExactly("Yes?");
    }

    @Test
    void rejoinsLinesWrappedMidSentence() {
        String text = "Please describe your approach to\nproject management and delivery.";

        assertThat(detector.detect(text))
                .containsExactly("Please describe your approach to project management and delivery.");
    }

    @Test
    void dropsLoneBulletGlyphLines() {
        String text = "G\nDescribe your security certifications.\n●\nHow do you handle backups?";

        assertThat(detector.normalize(text))
                .isEqualTo("Describe your security certifications.\nHow do you handle backups?");
        assertThat(detector.detect(text))
                .containsExactly("Describe your security certifications.", "How do you handle backups?");
    }

    @Test
    void starterWordAfterBulletPrefixCounts() {
        assertThat(detector.detect("- Which regions do you serve")).containsExactly("- Which regions do you serve");
    }

    @Test
    void keepsFirstOccurrenceOfDuplicates() {
        String text = "What is your price?\nHow fast can you deliver?\nWhat is your price?";

        assertThat(detector.detect(text)).containsExactly("What is your price?", "How fast can you deliver?");
    }

    @Test
    void plainStatementsAreNotQuestions() {
        assertThat(detector.detect("Our company was founded in 1999. Offices span three continents."))
                .isEmpty();
        assertThat(detector.detect("   ")).isEmpty();
        assertThat(detector.detect(null)).isEmpty();
    }

    @Test
    void customRuleSetReplacesDefaults() {
        QuestionDetector strict = new QuestionDetector(new DetectionProperties(),
                List.of(QuestionRules.endsWithQuestionMark()));

        assertThat(strict.detect("Describe your approach. Is pricing fixed?"))
                .containsExactly("Is pricing fixed?");
    }

    @Test
    void numberedPatternRequiresTerminalQuestionMark() {
        QuestionRule numbered = QuestionRules.matching(QuestionRules.NUMBERED);

        assertThat(numbered.matches("3) Who maintains the platform?")).isTrue();
        assertThat(numbered.matches("3) The platform is maintained in-house.")).isFalse();
    }
}
