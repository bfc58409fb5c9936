package com.travelease.formapi.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DispatchSettings Tests")
class DispatchSettingsTest {

    @Test
    @DisplayName("should treat blank values as not configured and default the modes")
    void testBlankValues() {
        DispatchSettings settings = new DispatchSettings("sender@x.com", "", "  ", "", " ", "", null, null, null);

        assertThat(settings.ownerEmail()).isNull();
        assertThat(settings.businessEmail()).isNull();
        assertThat(settings.configurationSet()).isNull();
        assertThat(settings.queueUrl()).isNull();
        assertThat(settings.tableName()).isNull();
        assertThat(settings.executionMode()).isEqualTo(DispatchSettings.ExecutionMode.SEQUENTIAL);
        assertThat(settings.failureMode()).isEqualTo(DispatchSettings.FailureMode.FAIL_FAST);
    }

    @Test
    @DisplayName("should fall back to the sender identity for the owner")
    void testResolvedOwnerEmail() {
        assertThat(new DispatchSettings("sender@x.com", null, null, null, null, null, null, null, null)
                .resolvedOwnerEmail()).isEqualTo("sender@x.com");
        assertThat(new DispatchSettings("sender@x.com", "owner@x.com", null, null, null, null, null, null, null)
                .resolvedOwnerEmail()).isEqualTo("owner@x.com");
    }

    @Test
    @DisplayName("should only expose a business address that differs from the owner")
    void testDistinctBusinessEmail() {
        assertThat(new DispatchSettings("s@x.com", "owner@x.com", "Owner@X.com", null, null, null, null, null, null)
                .distinctBusinessEmail()).isNull();
        assertThat(new DispatchSettings("s@x.com", null, "s@x.com", null, null, null, null, null, null)
                .distinctBusinessEmail()).isNull();
        assertThat(new DispatchSettings("s@x.com", "owner@x.com", "sales@x.com", null, null, null, null, null, null)
                .distinctBusinessEmail()).isEqualTo("sales@x.com");
    }
}
