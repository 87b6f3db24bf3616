package com.example.rfp.responderservice.exception;

/**
 * Two vectors of different length were compared. Usually means the embedding model changed
 * after the knowledge base was built, so stored chunk vectors are no longer comparable.
 */
public class DimensionMismatchException extends RfpResponderException {

    public DimensionMismatchException(int expected, int actual) {
        super("Embedding dimension mismatch: expected " + expected + " but got " + actual);
    }
}
