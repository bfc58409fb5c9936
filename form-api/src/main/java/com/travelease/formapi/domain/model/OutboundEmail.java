package com.travelease.formapi.domain.model;

/**
 * A single email as handed to the email sender.
 *
 * @param configurationSet provider configuration-set tag, {@code null} when none is configured
 */
public record OutboundEmail(
        String source,
        String recipient,
        EmailContent content,
        String configurationSet
) {}
