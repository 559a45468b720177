package com.purchasingpower.orchestrator.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.io.Serializable;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Locale;
import java.util.Set;

/**
 * Caller-supplied, read-only view of who is asking.
 *
 * Biases parameter resolution (the caller's timezone decides what "today" means) and
 * filters which domains and tools are eligible for a request.
 */
@Value
@Builder(toBuilder = true)
public class UserContext implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String PUBLIC_ACCESS = "public";
    public static final String ADMIN_ROLE = "admin";

    String role;
    String department;
    @Singular("scope")
    Set<String> accessScope;
    String timezone;

    public static UserContext anonymous() {
        return UserContext.builder().role("user").timezone("UTC").build();
    }

    /**
     * Resolved zone; unknown or blank timezones fall back to UTC.
     */
    public ZoneId zoneId() {
        if (timezone == null || timezone.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            return ZoneOffset.UTC;
        }
    }

    public LocalDate today(Clock clock) {
        return LocalDate.now(clock.withZone(zoneId()));
    }

    /**
     * Whether this caller may use a domain or tool guarded by the given access level.
     */
    public boolean canAccess(String accessLevel) {
        if (accessLevel == null || accessLevel.isBlank() || PUBLIC_ACCESS.equalsIgnoreCase(accessLevel)) {
            return true;
        }
        if (role != null && ADMIN_ROLE.equalsIgnoreCase(role)) {
            return true;
        }
        String wanted = accessLevel.toLowerCase(Locale.ROOT);
        if (department != null && wanted.equals(department.toLowerCase(Locale.ROOT))) {
            return true;
        }
        return accessScope != null && accessScope.stream()
                .anyMatch(scope -> scope.equalsIgnoreCase(wanted));
    }
}
