package com.ttm.backend.pr.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

/** weight 只影響 squat 判斷；可不帶 */
public record NormalizeRequest(
        @NotNull @Size(max = 200) String name,
        @PositiveOrZero Double weight
) {}
