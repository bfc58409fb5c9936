package com.travelease.formapi.domain.model;

/**
 * Which collaborators are configured for dispatch. A {@code null} destination disables its channel.
 */
public record DispatchSettings(
        String sourceEmail,
        String ownerEmail,
        String businessEmail,
        String configurationSet,
        String queueUrl,
        String tableName,
        String topicArn,
        ExecutionMode executionMode,
        FailureMode failureMode
) {
    public enum ExecutionMode {
        SEQUENTIAL,
        PARALLEL
    }

    public enum FailureMode {
        FAIL_FAST,
        REPORT
    }

    public DispatchSettings {
        sourceEmail = trimToNull(sourceEmail);
        ownerEmail = trimToNull(ownerEmail);
        businessEmail = trimToNull(businessEmail);
        configurationSet = trimToNull(configurationSet);
        queueUrl = trimToNull(queueUrl);
        tableName = trimToNull(tableName);
        topicArn = trimToNull(topicArn);
        if (executionMode == null) {
            executionMode = ExecutionMode.SEQUENTIAL;
        }
        if (failureMode == null) {
            failureMode = FailureMode.FAIL_FAST;
        }
    }

    /** Owner address, falling back to the sender identity. */
    public String resolvedOwnerEmail() {
        return ownerEmail != null ? ownerEmail : sourceEmail;
    }

    /** Business address when it is configured and differs from the owner address. */
    public String distinctBusinessEmail() {
        if (businessEmail == null) {
            return null;
        }
        String owner = resolvedOwnerEmail();
        return owner != null && owner.equalsIgnoreCase(businessEmail) ? null : businessEmail;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
