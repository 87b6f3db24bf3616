package com.example.rfp.responderservice.model;

import java.time.Instant;
import java.util.List;

public record ResponseDocument(String title, Instant generatedAt, String summary, List<Item> items) {

    public record Item(int index, String question, String answer) {}
}
