package com.purchasingpower.orchestrator.registry;

import com.purchasingpower.orchestrator.exception.UnknownCapabilityException;
import com.purchasingpower.orchestrator.model.UserContext;
import com.purchasingpower.orchestrator.tools.CalculatorTool;
import com.purchasingpower.orchestrator.tools.LateMinutesTool;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Capability Registry Tests")
class CapabilityRegistryTest {

    @Test
    @DisplayName("Should register tools discovered at startup")
    void constructor_registersAllTools() {
        // Given / When
        CapabilityRegistry registry = new CapabilityRegistry(List.of(new CalculatorTool(), new LateMinutesTool()));

        // Then
        assertThat(registry.names()).containsExactly("calculator", "late_minutes");
        assertThat(registry.require("calculator").schema().getRequiredParameters()).containsExactly("expression");
    }

    @Test
    @DisplayName("Hot reload should not change an entry a request already looked up")
    void register_replacementKeepsEarlierLookupStable() {
        // Given
        CapabilityRegistry registry = new CapabilityRegistry(List.of(new CalculatorTool()));
        RegisteredCapability before = registry.require("calculator");

        // When
        RegisteredCapability after = registry.register(new CalculatorTool());

        // Then
        assertThat(after.revision()).isGreaterThan(before.revision());
        assertThat(registry.require("calculator")).isSameAs(after);
        assertThat(before.handle()).isNotSameAs(after.handle());
        assertThat(before.schema().getName()).isEqualTo("calculator");
    }

    @Test
    @DisplayName("Unregistered capabilities are unknown")
    void unregister_removesCapability() {
        // Given
        CapabilityRegistry registry = new CapabilityRegistry(List.of(new CalculatorTool()));

        // When
        boolean removed = registry.unregister("calculator");

        // Then
        assertThat(removed).isTrue();
        assertThat(registry.unregister("calculator")).isFalse();
        assertThat(registry.lookup("calculator")).isEmpty();
        assertThatThrownBy(() -> registry.require("calculator"))
                .isInstanceOf(UnknownCapabilityException.class);
    }

    @Test
    @DisplayName("Access-guarded tools are only eligible for matching callers")
    void isEligible_respectsAccessLevel() {
        // Given
        CapabilityRegistry registry = new CapabilityRegistry(List.of(new CalculatorTool(), new LateMinutesTool()));
        UserContext anonymous = UserContext.anonymous();
        UserContext hrUser = UserContext.builder().role("user").department("HR").build();
        UserContext scoped = UserContext.builder().role("user").scope("hr").build();

        // Then
        assertThat(registry.isEligible("calculator", anonymous)).isTrue();
        assertThat(registry.isEligible("late_minutes", anonymous)).isFalse();
        assertThat(registry.isEligible("late_minutes", hrUser)).isTrue();
        assertThat(registry.isEligible("late_minutes", scoped)).isTrue();
        assertThat(registry.isEligible("missing", hrUser)).isFalse();
    }
}
