package com.example.rfp.responderservice.dto;

import jakarta.validation.constraints.NotNull;

public record EditAnswerRequest(@NotNull String answer) {}
