package com.example.rfp.responderservice.repo;

import lombok.*;
import org.springframework.data.annotation.Id;

import java.time.Instant;

@Data @Builder @NoArgsConstructor @AllArgsConstructor
public class KeyValueRecord {
    @Id
    private String key;
    private byte[] value;
    private Instant updatedAt;
}
