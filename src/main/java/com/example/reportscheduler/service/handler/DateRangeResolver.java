package com.example.reportscheduler.service.handler;

import com.example.reportscheduler.domain.enums.DateRangeKind;
import com.example.reportscheduler.service.trigger.TriggerCalculator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;

/**
 * Turns a date range kind into concrete dates relative to "today" in the schedule's timezone.
 * <p>
 * Weeks run Monday to Sunday. The previous_N_days kinds end today, inclusive.
 */
@Component
@RequiredArgsConstructor
public class DateRangeResolver {

    private final TriggerCalculator triggerCalculator;

    public DateRange resolve(DateRangeKind kind, Instant now, String timezone) {
        var zone = triggerCalculator.resolveZone(timezone)
                .orElseThrow(() -> new IllegalArgumentException("Unknown timezone: " + timezone));
        return resolve(kind, now.atZone(zone).toLocalDate());
    }

    public DateRange resolve(DateRangeKind kind, LocalDate today) {
        if (kind == null) {
            throw new IllegalArgumentException("A date range is required for report jobs");
        }

        return switch (kind) {
            case PREVIOUS_DAY -> new DateRange(today.minusDays(1), today.minusDays(1));
            case PREVIOUS_WEEK -> {
                var end = lastCompleteSunday(today);
                yield new DateRange(end.minusDays(6), end);
            }
            case PREVIOUS_2_WEEKS -> {
                var end = lastCompleteSunday(today);
                yield new DateRange(end.minusDays(13), end);
            }
            case PREVIOUS_MONTH -> {
                var end = today.withDayOfMonth(1).minusDays(1);
                yield new DateRange(end.withDayOfMonth(1), end);
            }
            case PREVIOUS_7_DAYS -> lastDays(today, 7);
            case PREVIOUS_14_DAYS -> lastDays(today, 14);
            case PREVIOUS_30_DAYS -> lastDays(today, 30);
        };
    }

    /**
     * Sunday ending the last week that is over, a week back when today is itself a Sunday
     */
    private static LocalDate lastCompleteSunday(LocalDate today) {
        return today.with(TemporalAdjusters.previous(DayOfWeek.SUNDAY));
    }

    private static DateRange lastDays(LocalDate today, int days) {
        return new DateRange(today.minusDays(days - 1L), today);
    }
}
