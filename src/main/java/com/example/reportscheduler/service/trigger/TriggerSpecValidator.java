package com.example.reportscheduler.service.trigger;

import com.example.reportscheduler.domain.enums.IntervalUnit;
import com.example.reportscheduler.domain.enums.TriggerKind;
import com.example.reportscheduler.exception.ScheduleValidationException;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Strict syntax checks for trigger definitions submitted by administrators.
 * <p>
 * Unlike {@link TriggerCalculator}, which degrades to "never fires", this rejects bad input
 * so that no partially valid schedule is ever persisted.
 */
@Component
public class TriggerSpecValidator {

    /**
     * Validate the raw trigger fields and build the matching spec
     *
     * @throws ScheduleValidationException listing every problem found
     */
    public TriggerSpec validate(TriggerKind kind, String cronExpression, String intervalUnit, Integer intervalValue,
                                LocalDateTime anchorTime, String timezone) {
        var errors = new ArrayList<String>();

        if (timezone != null && !timezone.isBlank()) {
            try {
                ZoneId.of(timezone.trim());
            } catch (DateTimeException e) {
                errors.add("timezone: unknown zone '" + timezone + "'");
            }
        }

        if (kind == null) {
            errors.add("triggerKind: must be cron or interval");
            throw new ScheduleValidationException(errors);
        }

        TriggerSpec spec = switch (kind) {
            case CRON -> validateCron(cronExpression, timezone, errors);
            case INTERVAL -> validateInterval(intervalUnit, intervalValue, anchorTime, timezone, errors);
        };

        if (!errors.isEmpty()) {
            throw new ScheduleValidationException(errors);
        }
        return spec;
    }

    private CronSpec validateCron(String expression, String timezone, List<String> errors) {
        if (expression == null || expression.isBlank()) {
            errors.add("cronExpression: is required for cron schedules");
            return null;
        }

        var fields = expression.trim().split("\\s+");
        if (fields.length != 5) {
            errors.add("cronExpression: expected 5 fields (minute hour day month weekday) but got " + fields.length);
            return null;
        }

        try {
            CronExpression.parse("0 " + expression.trim());
        } catch (IllegalArgumentException e) {
            errors.add("cronExpression: " + e.getMessage());
            return null;
        }

        return CronSpec.fromExpression(expression, blankToNull(timezone));
    }

    private IntervalSpec validateInterval(String unit, Integer value, LocalDateTime anchorTime, String timezone,
                                          List<String> errors) {
        if (IntervalUnit.find(unit).isEmpty()) {
            errors.add("intervalUnit: must be one of minutes, hours, days, weeks");
        }
        if (value == null || value <= 0) {
            errors.add("intervalValue: must be a positive number");
        }
        if (!errors.isEmpty()) {
            return null;
        }

        return IntervalSpec.builder()
                .unit(IntervalUnit.fromCode(unit).getCode())
                .value(value)
                .anchorTime(anchorTime)
                .timezone(blankToNull(timezone))
                .build();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
