package com.ttm.backend.pr.dto;

public record NormalizeResponse(String raw, String normalized) {}
