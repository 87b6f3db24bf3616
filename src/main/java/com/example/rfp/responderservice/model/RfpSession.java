package com.example.rfp.responderservice.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * The last processed RFP, kept so answers can be reviewed and edited before export.
 */
@Data @Builder @NoArgsConstructor @AllArgsConstructor
public class RfpSession {
    private String projectName;
    private String fileName;
    @Builder.Default
    private List<AnsweredQuestion> questions = new ArrayList<>();
    private String summary;
    private Instant processedAt;
}
