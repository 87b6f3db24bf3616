package com.example.rfp.responderservice.model;

/**
 * A checkpoint reported while a document is being ingested or processed.
 */
public record ProcessingProgress(
        String stage,
        int currentItem,
        int totalItems,
        String message,
        ProcessingStatus status
) {

    public static ProcessingProgress inProgress(String stage, int current, int total, String message) {
        return new ProcessingProgress(stage, current, total, message, ProcessingStatus.IN_PROGRESS);
    }

    public static ProcessingProgress completed(int total, String message) {
        return new ProcessingProgress("Complete", total, total, message, ProcessingStatus.COMPLETED);
    }

    public double percentComplete() {
        return totalItems > 0 ? (currentItem / (double) totalItems) * 100 : 0;
    }
}
