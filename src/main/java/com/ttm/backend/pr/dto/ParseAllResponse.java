package com.ttm.backend.pr.dto;

import java.util.List;

public record ParseAllResponse(int count, List<PrDto> prs) {}
