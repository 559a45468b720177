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

import java.text.ParsePosition;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Date and time operations evaluated in the caller's timezone.
 *
 * Relative words ("now", "today", "tomorrow", "yesterday") are resolved against the
 * caller's zone, never the server's.
 */
@Slf4j
@Component
public class DateTimeTool implements Tool {

    public static final String NAME = "datetime";

    private static final String DEFAULT_FORMAT = "yyyy-MM-dd HH:mm:ss";

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"),
            DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm:ss"),
            DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm"));

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("dd/MM/yyyy"));

    private static final ToolSchema SCHEMA = ToolSchema.builder(NAME)
            .description("Date and time operations: current time or date, adding or subtracting time, "
                    + "timezone conversion, difference between two moments, day of week.")
            .category(ToolCategory.DATETIME)
            .version("1.2")
            .required(ParameterSpec.builder()
                    .name("operation")
                    .type(ParameterType.STRING)
                    .description("What to compute")
                    .enumValue("current_time").enumValue("current_date").enumValue("current_datetime")
                    .enumValue("add_time").enumValue("subtract_time").enumValue("convert_timezone")
                    .enumValue("time_difference").enumValue("day_of_week")
                    .build())
            .optional(ParameterSpec.builder()
                    .name("timezone")
                    .type(ParameterType.STRING)
                    .description("IANA zone such as Asia/Ho_Chi_Minh; defaults to the user's timezone")
                    .build())
            .optional(ParameterSpec.builder()
                    .name("datetime")
                    .type(ParameterType.STRING)
                    .description("Input moment, yyyy-MM-dd or yyyy-MM-dd HH:mm:ss, or now/today/tomorrow/yesterday; "
                            + "omit for relative expressions so the current time is used")
                    .build())
            .optional(ParameterSpec.builder()
                    .name("amount")
                    .type(ParameterType.INTEGER)
                    .description("Amount to add or subtract")
                    .build())
            .optional(ParameterSpec.builder()
                    .name("unit")
                    .type(ParameterType.STRING)
                    .description("Unit of amount")
                    .enumValue("seconds").enumValue("minutes").enumValue("hours")
                    .enumValue("days").enumValue("weeks").enumValue("months").enumValue("years")
                    .defaultValue("days")
                    .build())
            .optional(ParameterSpec.builder()
                    .name("target_timezone")
                    .type(ParameterType.STRING)
                    .description("Zone to convert into for convert_timezone")
                    .build())
            .optional(ParameterSpec.builder()
                    .name("second_datetime")
                    .type(ParameterType.STRING)
                    .description("Second moment for time_difference")
                    .build())
            .optional(ParameterSpec.builder()
                    .name("format")
                    .type(ParameterType.STRING)
                    .description("Output pattern (java.time syntax)")
                    .defaultValue(DEFAULT_FORMAT)
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
        return ToolCategory.DATETIME;
    }

    @Override
    public ToolResult execute(ParsedParameters parameters, ToolContext context) {
        String operation = parameters.getString("operation").orElse("");
        try {
            ZoneId zone = parameters.getString("timezone")
                    .map(ZoneId::of)
                    .orElse(context.getUserContext().zoneId());
            DateTimeFormatter output = DateTimeFormatter.ofPattern(
                    parameters.getString("format").orElse(DEFAULT_FORMAT), Locale.ENGLISH);
            ZonedDateTime now = ZonedDateTime.now(context.getClock().withZone(zone));

            String result = compute(operation, parameters, zone, now, output);
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("operation", operation);
            data.put("timezone", zone.getId());
            data.put("result", result);
            return ToolResult.success(result, data, List.of("tool:" + NAME));

        } catch (DateTimeException | IllegalArgumentException e) {
            log.warn("datetime operation {} rejected: {}", operation, e.getMessage());
            return ToolResult.invalidArguments("datetime " + operation + " failed: " + e.getMessage());
        }
    }

    private String compute(String operation, ParsedParameters parameters, ZoneId zone, ZonedDateTime now,
                           DateTimeFormatter output) {
        switch (operation) {
            case "current_time":
                return now.format(DateTimeFormatter.ofPattern("HH:mm:ss"));
            case "current_date":
                return now.toLocalDate().toString();
            case "current_datetime":
                return now.format(output);
            case "day_of_week": {
                ZonedDateTime moment = parameters.getString("datetime")
                        .map(text -> parse(text, zone, now))
                        .orElse(now);
                return moment.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH);
            }
            case "add_time":
            case "subtract_time": {
                ZonedDateTime base = parameters.getString("datetime")
                        .map(text -> parse(text, zone, now))
                        .orElse(now);
                long amount = parameters.getLong("amount")
                        .orElseThrow(() -> new IllegalArgumentException("amount is required for " + operation));
                ChronoUnit unit = unitOf(parameters.getString("unit").orElse("days"));
                long signed = "add_time".equals(operation) ? amount : -amount;
                return base.plus(signed, unit).format(output);
            }
            case "convert_timezone": {
                ZonedDateTime base = parse(requireText(parameters, "datetime", operation), zone, now);
                ZoneId target = ZoneId.of(requireText(parameters, "target_timezone", operation));
                return base.withZoneSameInstant(target).format(output);
            }
            case "time_difference": {
                ZonedDateTime first = parse(requireText(parameters, "datetime", operation), zone, now);
                ZonedDateTime second = parse(requireText(parameters, "second_datetime", operation), zone, now);
                return describe(Duration.between(first, second).abs());
            }
            default:
                throw new IllegalArgumentException("Unsupported operation '" + operation + "'");
        }
    }

    private static String requireText(ParsedParameters parameters, String name, String operation) {
        return parameters.getString(name)
                .orElseThrow(() -> new IllegalArgumentException(name + " is required for " + operation));
    }

    static ZonedDateTime parse(String text, ZoneId zone, ZonedDateTime now) {
        String value = text.trim();
        switch (value.toLowerCase(Locale.ROOT)) {
            case "now":
                return now;
            case "today":
                return now.toLocalDate().atStartOfDay(zone);
            case "tomorrow":
                return now.toLocalDate().plusDays(1).atStartOfDay(zone);
            case "yesterday":
                return now.toLocalDate().minusDays(1).atStartOfDay(zone);
            default:
                break;
        }
        if (fullyMatches(DateTimeFormatter.ISO_OFFSET_DATE_TIME, value)) {
            return OffsetDateTime.parse(value).atZoneSameInstant(zone);
        }
        for (DateTimeFormatter format : DATE_TIME_FORMATS) {
            if (fullyMatches(format, value)) {
                return LocalDateTime.parse(value, format).atZone(zone);
            }
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            if (fullyMatches(format, value)) {
                return LocalDate.parse(value, format).atStartOfDay(zone);
            }
        }
        throw new IllegalArgumentException("Unrecognized date/time '" + text + "'");
    }

    private static boolean fullyMatches(DateTimeFormatter format, String value) {
        ParsePosition position = new ParsePosition(0);
        format.parseUnresolved(value, position);
        return position.getErrorIndex() < 0 && position.getIndex() == value.length();
    }

    private static ChronoUnit unitOf(String unit) {
        switch (unit.toLowerCase(Locale.ROOT)) {
            case "seconds":
                return ChronoUnit.SECONDS;
            case "minutes":
                return ChronoUnit.MINUTES;
            case "hours":
                return ChronoUnit.HOURS;
            case "days":
                return ChronoUnit.DAYS;
            case "weeks":
                return ChronoUnit.WEEKS;
            case "months":
                return ChronoUnit.MONTHS;
            case "years":
                return ChronoUnit.YEARS;
            default:
                throw new IllegalArgumentException("Invalid unit '" + unit + "'");
        }
    }

    private static String describe(Duration duration) {
        List<String> parts = new ArrayList<>();
        long days = duration.toDays();
        long hours = duration.toHoursPart();
        long minutes = duration.toMinutesPart();
        long seconds = duration.toSecondsPart();
        if (days > 0) {
            parts.add(days + " days");
        }
        if (hours > 0) {
            parts.add(hours + " hours");
        }
        if (minutes > 0) {
            parts.add(minutes + " minutes");
        }
        if (seconds > 0) {
            parts.add(seconds + " seconds");
        }
        return parts.isEmpty() ? "0 seconds" : String.join(", ", parts);
    }
}
