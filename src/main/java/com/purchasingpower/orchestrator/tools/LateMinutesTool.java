package com.purchasingpower.orchestrator.tools;

import com.purchasingpower.orchestrator.registry.ParameterSpec;
import com.purchasingpower.orchestrator.registry.ParameterType;
import com.purchasingpower.orchestrator.registry.ParsedParameters;
import com.purchasingpower.orchestrator.registry.Tool;
import com.purchasingpower.orchestrator.registry.ToolContext;
import com.purchasingpower.orchestrator.registry.ToolResult;
import com.purchasingpower.orchestrator.registry.ToolSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;

/**
 * Attendance lateness report for one or more users over a period.
 *
 * The attendance system itself is external; this capability serves simulated records
 * seeded by user name, so the same user and period always report the same numbers.
 */
@Slf4j
@Component
public class LateMinutesTool implements Tool {

    public static final String NAME = "late_minutes";

    private static final Map<String, Integer> WORKDAYS_PER_PERIOD = Map.of(
            "day", 1, "week", 5, "month", 22, "year", 250);

    private static final ToolSchema SCHEMA = ToolSchema.builder(NAME)
            .description("Reports how many minutes users arrived late or left early over a day, week, month or year.")
            .category(ToolCategory.ATTENDANCE)
            .version("1.0")
            .accessLevel("hr")
            .required(ParameterSpec.builder()
                    .name("users")
                    .type(ParameterType.ARRAY)
                    .itemType(ParameterType.STRING)
                    .description("Usernames, names or emails, always a JSON array even for one user")
                    .build())
            .required(ParameterSpec.builder()
                    .name("time_period")
                    .type(ParameterType.STRING)
                    .description("Period to report")
                    .enumValue("day").enumValue("week").enumValue("month").enumValue("year")
                    .build())
            .optional(ParameterSpec.builder()
                    .name("checkin_time")
                    .type(ParameterType.STRING)
                    .description("Expected check-in, HH:mm")
                    .defaultValue("09:00")
                    .build())
            .optional(ParameterSpec.builder()
                    .name("checkout_time")
                    .type(ParameterType.STRING)
                    .description("Expected check-out, HH:mm")
                    .defaultValue("18:00")
                    .build())
            .build();

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return SCHEMA.getDescription();
    }

    @Override
    public ToolSchema getSchema() {
        return SCHEMA;
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.ATTENDANCE;
    }

    @Override
    public ToolResult execute(ParsedParameters parameters, ToolContext context) {
        List<String> users = parameters.getStringList("users");
        if (users.isEmpty()) {
            return ToolResult.invalidArguments("users must list at least one user");
        }
        String period = parameters.getString("time_period").orElse("").toLowerCase(Locale.ROOT);
        Integer workdays = WORKDAYS_PER_PERIOD.get(period);
        if (workdays == null) {
            return ToolResult.invalidArguments("time_period must be one of day, week, month, year");
        }

        LocalTime checkin;
        LocalTime checkout;
        try {
            checkin = LocalTime.parse(parameters.getString("checkin_time").orElse("09:00"));
            checkout = LocalTime.parse(parameters.getString("checkout_time").orElse("18:00"));
        } catch (DateTimeParseException e) {
            return ToolResult.invalidArguments("checkin_time and checkout_time must be HH:mm: " + e.getMessage());
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        StringBuilder report = new StringBuilder("Late minutes per user (")
                .append(period).append(", expected ").append(checkin).append("-").append(checkout).append("):");
        for (String user : users) {
            Map<String, Object> row = simulate(user, workdays);
            rows.add(row);
            report.append("\n- ").append(user).append(": ")
                    .append(row.get("total_minutes")).append(" minutes over ")
                    .append(row.get("late_days")).append(" late day(s)");
        }

        log.debug("⏰ late_minutes for {} users over {}", users.size(), period);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("time_period", period);
        data.put("results", rows);
        return ToolResult.success(report.toString(), data, List.of("attendance:" + period));
    }

    private static Map<String, Object> simulate(String user, int workdays) {
        Random random = new Random(user.trim().toLowerCase(Locale.ROOT).hashCode());
        int total = 0;
        int lateDays = 0;
        for (int day = 0; day < workdays; day++) {
            int late = random.nextDouble() < 0.35 ? random.nextInt(46) : 0;
            int early = random.nextDouble() < 0.15 ? random.nextInt(31) : 0;
            if (late + early > 0) {
                lateDays++;
            }
            total += late + early;
        }
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("user", user);
        row.put("total_minutes", total);
        row.put("late_days", lateDays);
        row.put("workdays", workdays);
        return row;
    }
}
