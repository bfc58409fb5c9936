package com.travelease.formapi.domain.exception;

/**
 * A collaborator required for every submission is not configured.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
