package com.ttm.backend.pr.program;

import lombok.Getter;

@Getter
public class ProgramApiException extends RuntimeException {

    /** HTTP 狀態；連不上時為 0 */
    private final int status;
    private final String bodySnippet;

    public ProgramApiException(int status, String message, String bodySnippet) {
        super(message);
        this.status = status;
        this.bodySnippet = bodySnippet;
    }

    public ProgramApiException(int status, String message, String bodySnippet, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.bodySnippet = bodySnippet;
    }
}
