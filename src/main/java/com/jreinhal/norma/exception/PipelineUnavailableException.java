package com.jreinhal.norma.exception;

public class PipelineUnavailableException extends RuntimeException {
    private final String requestId;

    public PipelineUnavailableException(String requestId, String message, Throwable cause) {
        super(message, cause);
        this.requestId = requestId;
    }

    public String getRequestId() {
        return this.requestId;
    }
}
