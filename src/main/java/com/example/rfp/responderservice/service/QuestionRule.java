package com.example.rfp.responderservice.service;

/**
 * One heuristic for recognising a question. A candidate is a question when any rule matches.
 */
@FunctionalInterface
public interface QuestionRule {

    boolean matches(String candidate);
}
