package com.example.reportscheduler.service.trigger;

import com.example.reportscheduler.domain.enums.TriggerKind;
import lombok.Builder;
import lombok.Value;

import java.util.stream.Stream;

/**
 * Five-field cron trigger: minute, hour, day-of-month, month, day-of-week.
 */
@Value
@Builder
public class CronSpec implements TriggerSpec {

    String minute;
    String hour;
    String day;
    String month;
    String weekday;
    String timezone;

    /**
     * Split an expression into its fields. An expression without exactly five fields
     * yields a spec with no fields, which the calculator treats as never firing.
     */
    public static CronSpec fromExpression(String expression, String timezone) {
        var builder = CronSpec.builder().timezone(timezone);
        if (expression == null) {
            return builder.build();
        }
        var parts = expression.trim().split("\\s+");
        if (parts.length != 5) {
            return builder.build();
        }
        return builder
                .minute(parts[0])
                .hour(parts[1])
                .day(parts[2])
                .month(parts[3])
                .weekday(parts[4])
                .build();
    }

    @Override
    public TriggerKind getKind() {
        return TriggerKind.CRON;
    }

    public boolean isComplete() {
        return Stream.of(minute, hour, day, month, weekday).allMatch(f -> f != null && !f.isBlank());
    }

    public String toExpression() {
        return String.join(" ", minute, hour, day, month, weekday);
    }
}
