package com.travelease.formapi.infrastructure.exception;

public class InfrastructureException extends RuntimeException {

    private final String service;

    public InfrastructureException(String service, String message, Throwable cause) {
        super(message, cause);
        this.service = service;
    }

    /**
     * Wraps an SDK failure. The message is the SDK's own text, unchanged; the failing service is kept
     * alongside it for logging.
     */
    public static InfrastructureException wrap(String service, Throwable cause) {
        if (cause instanceof InfrastructureException existing) {
            return existing;
        }
        String detail = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
        return new InfrastructureException(service, detail, cause);
    }

    public String getService() {
        return service;
    }
}
