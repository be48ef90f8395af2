package com.ttm.backend.pr.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/** status: ok / not_found；not_found 時 pr 不輸出 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ParsePrResponse(String status, PrDto pr) {

    public static ParsePrResponse ok(PrDto pr) {
        return new ParsePrResponse("ok", pr);
    }

    public static ParsePrResponse notFound() {
        return new ParsePrResponse("not_found", null);
    }
}
