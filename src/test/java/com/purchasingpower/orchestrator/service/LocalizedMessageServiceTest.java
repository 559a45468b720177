package com.purchasingpower.orchestrator.service;

import com.purchasingpower.orchestrator.support.TestFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Localized Message Service Tests")
class LocalizedMessageServiceTest {

    private final LocalizedMessageService messages = TestFixtures.messages();

    @Test
    @DisplayName("Region suffixes resolve to the base language")
    void get_normalizesLanguage() {
        assertThat(messages.get("error_cancelled", "vi-VN")).isEqualTo("Yêu cầu đã bị hủy.");
        assertThat(messages.get("error_cancelled", "es_MX")).isEqualTo("La solicitud fue cancelada.");
        assertThat(messages.supports("VI")).isTrue();
    }

    @Test
    @DisplayName("Unknown languages fall back to English, unknown keys to the key")
    void get_fallsBack() {
        assertThat(messages.get("error_cancelled", "fr")).isEqualTo("The request was cancelled.");
        assertThat(messages.get("error_cancelled", null)).isEqualTo("The request was cancelled.");
        assertThat(messages.get("no_such_key", "vi")).isEqualTo("no_such_key");
        assertThat(messages.supports("fr")).isFalse();
    }
}
