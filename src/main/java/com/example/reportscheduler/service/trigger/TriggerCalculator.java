package com.example.reportscheduler.service.trigger;

import com.example.reportscheduler.config.TaskSchedulerProperties;
import com.example.reportscheduler.domain.enums.IntervalUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Computes future fire times for cron and interval triggers.
 * <p>
 * Deterministic and side-effect free. A malformed spec yields an empty sequence
 * instead of an exception so callers on the firing path never fail on bad input.
 */
@Slf4j
@Component
public class TriggerCalculator {

    private final ZoneId defaultZone;

    @Autowired
    public TriggerCalculator(TaskSchedulerProperties properties) {
        this(ZoneId.of(properties.getDefaultTimezone()));
    }

    public TriggerCalculator(ZoneId defaultZone) {
        this.defaultZone = defaultZone;
    }

    /**
     * Next {@code count} fire times strictly after {@code referenceTime}, in the spec's timezone.
     */
    public List<ZonedDateTime> computeNextRuns(TriggerSpec spec, Instant referenceTime, int count) {
        if (spec == null || referenceTime == null || count <= 0) {
            return List.of();
        }

        try {
            var zone = resolveZone(spec.getTimezone());
            if (zone.isEmpty()) {
                return List.of();
            }

            return switch (spec.getKind()) {
                case CRON -> cronRuns((CronSpec) spec, referenceTime.atZone(zone.get()), count);
                case INTERVAL -> intervalRuns((IntervalSpec) spec, referenceTime.atZone(zone.get()), count);
            };
        } catch (RuntimeException e) {
            log.debug("Could not compute fire times for {}: {}", spec, e.getMessage());
            return List.of();
        }
    }

    public Optional<ZonedDateTime> nextRun(TriggerSpec spec, Instant referenceTime) {
        return computeNextRuns(spec, referenceTime, 1).stream().findFirst();
    }

    public ZoneId getDefaultZone() {
        return defaultZone;
    }

    /**
     * Resolve a zone id, falling back to the default when none is set
     */
    public Optional<ZoneId> resolveZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return Optional.of(defaultZone);
        }
        try {
            return Optional.of(ZoneId.of(timezone.trim()));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    private List<ZonedDateTime> cronRuns(CronSpec spec, ZonedDateTime reference, int count) {
        if (!spec.isComplete()) {
            return List.of();
        }

        // Spring cron expressions carry a leading seconds field
        var expression = CronExpression.parse("0 " + spec.toExpression());

        var runs = new ArrayList<ZonedDateTime>(count);
        var current = reference;
        for (var i = 0; i < count; i++) {
            var next = expression.next(current);
            if (next == null) {
                break;
            }
            runs.add(next);
            current = next;
        }
        return runs;
    }

    private List<ZonedDateTime> intervalRuns(IntervalSpec spec, ZonedDateTime reference, int count) {
        var unit = IntervalUnit.find(spec.getUnit());
        if (unit.isEmpty() || spec.getValue() == null || spec.getValue() <= 0) {
            return List.of();
        }

        var anchor = spec.getAnchorTime() != null
                ? spec.getAnchorTime().atZone(reference.getZone())
                : reference;

        var k = firstIndexAfter(anchor, reference, unit.get(), spec.getValue());

        var runs = new ArrayList<ZonedDateTime>(count);
        for (var i = 0; i < count; i++) {
            runs.add(fireAt(anchor, k + i, unit.get(), spec.getValue()));
        }
        return runs;
    }

    /**
     * Smallest k >= 0 such that anchor + k * period is strictly after the reference
     */
    private long firstIndexAfter(ZonedDateTime anchor, ZonedDateTime reference, IntervalUnit unit, int value) {
        if (anchor.isAfter(reference)) {
            return 0;
        }

        long elapsed;
        if (unit.isCalendarBased()) {
            elapsed = unit.getChronoUnit().between(anchor, reference);
        } else {
            elapsed = Duration.between(anchor.toInstant(), reference.toInstant()).toSeconds()
                    / unit.getChronoUnit().getDuration().toSeconds();
        }

        var k = Math.max(0, elapsed / value);
        while (!fireAt(anchor, k, unit, value).isAfter(reference)) {
            k++;
        }
        return k;
    }

    private ZonedDateTime fireAt(ZonedDateTime anchor, long k, IntervalUnit unit, int value) {
        var amount = Math.multiplyExact(k, (long) value);
        if (unit.isCalendarBased()) {
            return anchor.plus(amount, unit.getChronoUnit());
        }
        return anchor.toInstant()
                .plus(unit.getChronoUnit().getDuration().multipliedBy(amount))
                .atZone(anchor.getZone());
    }
}
