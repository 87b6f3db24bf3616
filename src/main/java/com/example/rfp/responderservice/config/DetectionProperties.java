package com.example.rfp.responderservice.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Tuning knobs for question detection. The starter words and bullet glyphs are
 * heuristics observed on real RFP exports and are expected to change.
 */
@Data
@ConfigurationProperties(prefix = "app.detection")
public class DetectionProperties {

    /**
     * Candidates shorter than this are never treated as questions.
     */
    private int minLength = 10;

    private List<String> starters = new ArrayList<>(List.of(
            "what", "how", "why", "when", "where", "who", "which",
            "can", "could", "would", "will", "do", "does", "is", "are",
            "describe", "explain", "provide"));

    /**
     * Characters that symbol-font bullets turn into when a PDF is extracted. A line made of
     * exactly one of them is dropped.
     */
    private String bulletGlyphs = "GlnoO•●○◦▪▸►";
}
