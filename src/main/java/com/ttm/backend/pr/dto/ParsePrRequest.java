package com.ttm.backend.pr.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * programExercises 有帶就直接用（順序 = 同分優先順序）；
 * 沒帶且有 userId → 向課表 API 取。
 */
public record ParsePrRequest(
        @NotBlank @Size(max = 2000) String message,
        @Positive Long userId,
        List<String> programExercises
) {}
