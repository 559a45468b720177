package com.purchasingpower.orchestrator.tools;

import com.purchasingpower.orchestrator.model.UserContext;
import com.purchasingpower.orchestrator.registry.ParsedParameters;
import com.purchasingpower.orchestrator.registry.ToolResult;
import com.purchasingpower.orchestrator.support.TestFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DateTime Tool Tests")
class DateTimeToolTest {

    private final DateTimeTool tool = new DateTimeTool();

    @Test
    @DisplayName("Current date follows the caller's timezone")
    void currentDate_usesUserTimezone() {
        // Given: 10:30 UTC is already 17:30 in Ho Chi Minh City and 02:30 in Los Angeles
        UserContext saigon = UserContext.builder().role("user").timezone("Asia/Ho_Chi_Minh").build();

        // When
        ToolResult result = tool.execute(params("operation", "current_time"), TestFixtures.toolContext(saigon));

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getContent()).isEqualTo("17:30:00");
        assertThat(result.getData()).containsEntry("timezone", "Asia/Ho_Chi_Minh");
    }

    @Test
    @DisplayName("Explicit timezone parameter wins over the caller's timezone")
    void currentDate_explicitTimezone() {
        ToolResult result = tool.execute(params("operation", "current_date", "timezone", "America/Los_Angeles"),
                TestFixtures.toolContext());

        assertThat(result.getContent()).isEqualTo("2025-01-15");
    }

    @Test
    @DisplayName("'Tomorrow' is add_time of one day from now")
    void addTime_oneDay() {
        ToolResult result = tool.execute(params("operation", "add_time", "amount", 1L, "unit", "days",
                "format", "yyyy-MM-dd"), TestFixtures.toolContext());

        assertThat(result.getContent()).isEqualTo("2025-01-16");
    }

    @Test
    @DisplayName("Day of week of a given date")
    void dayOfWeek_givenDate() {
        ToolResult result = tool.execute(params("operation", "day_of_week", "datetime", "2025-01-18"),
                TestFixtures.toolContext());

        assertThat(result.getContent()).isEqualTo("Saturday");
    }

    @Test
    @DisplayName("Timezone conversion keeps the instant")
    void convertTimezone() {
        ToolResult result = tool.execute(params("operation", "convert_timezone",
                "datetime", "2025-01-15 09:00", "target_timezone", "Asia/Tokyo",
                "format", "yyyy-MM-dd HH:mm"), TestFixtures.toolContext());

        assertThat(result.getContent()).isEqualTo("2025-01-15 18:00");
    }

    @Test
    @DisplayName("Unknown zones and missing amounts are retryable argument errors")
    void invalidArguments_areRetryable() {
        ToolResult badZone = tool.execute(params("operation", "current_time", "timezone", "Mars/Olympus"),
                TestFixtures.toolContext());
        ToolResult noAmount = tool.execute(params("operation", "add_time"), TestFixtures.toolContext());

        assertThat(badZone.isSuccess()).isFalse();
        assertThat(badZone.isRetryable()).isTrue();
        assertThat(noAmount.isRetryable()).isTrue();
        assertThat(noAmount.getError()).contains("amount is required");
    }

    private static ParsedParameters params(Object... keyValues) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            values.put((String) keyValues[i], keyValues[i + 1]);
        }
        return ParsedParameters.of("datetime", values);
    }
}
