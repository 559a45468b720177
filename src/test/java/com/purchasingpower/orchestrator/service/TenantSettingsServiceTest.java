package com.purchasingpower.orchestrator.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Tenant Settings Service Tests")
class TenantSettingsServiceTest {

    private TenantSettingsService.TenantProperties properties;
    private TenantSettingsService service;

    @BeforeEach
    void setUp() {
        properties = new TenantSettingsService.TenantProperties();
        TenantSettingsService.TenantSettings vietnam = new TenantSettingsService.TenantSettings();
        vietnam.setTimezone("Asia/Ho_Chi_Minh");
        vietnam.setLanguage("vi");
        properties.getOverrides().put("acme-vn", vietnam);

        TenantSettingsService.TenantSettings partial = new TenantSettingsService.TenantSettings();
        partial.setTimezone("Europe/Madrid");
        partial.setLanguage(null);
        properties.getOverrides().put("partial", partial);

        service = new TenantSettingsService(properties);
    }

    @Test
    @DisplayName("Known tenants get their overrides, ids are case-insensitive")
    void settingsFor_knownTenant() {
        TenantSettingsService.TenantSettings settings = service.settingsFor("ACME-VN");

        assertThat(settings.getTimezone()).isEqualTo("Asia/Ho_Chi_Minh");
        assertThat(settings.getLanguage()).isEqualTo("vi");
    }

    @Test
    @DisplayName("Missing override fields and unknown tenants use the defaults")
    void settingsFor_defaults() {
        assertThat(service.settingsFor("partial").getLanguage()).isEqualTo("en");
        assertThat(service.settingsFor("partial").getTimezone()).isEqualTo("Europe/Madrid");
        assertThat(service.settingsFor("unknown").getTimezone()).isEqualTo("UTC");
        assertThat(service.settingsFor(null).getLanguage()).isEqualTo("en");
    }

    @Test
    @DisplayName("Invalidation picks up changed configuration")
    void invalidate_reloads() {
        // Given
        assertThat(service.settingsFor("acme-vn").getLanguage()).isEqualTo("vi");
        properties.getOverrides().get("acme-vn").setLanguage("en");

        // When / Then
        assertThat(service.settingsFor("acme-vn").getLanguage()).isEqualTo("vi");
        service.invalidate("acme-vn");
        assertThat(service.settingsFor("acme-vn").getLanguage()).isEqualTo("en");
    }
}
