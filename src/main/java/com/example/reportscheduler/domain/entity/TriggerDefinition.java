package com.example.reportscheduler.domain.entity;

import com.example.reportscheduler.domain.enums.TriggerKind;
import com.example.reportscheduler.service.trigger.CronSpec;
import com.example.reportscheduler.service.trigger.IntervalSpec;
import com.example.reportscheduler.service.trigger.TriggerSpec;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Persisted trigger columns shared by schedules and scheduler jobs.
 * <p>
 * Exactly one representation is populated: the cron columns for {@link TriggerKind#CRON},
 * the interval columns for {@link TriggerKind#INTERVAL}.
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TriggerDefinition {

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_kind", nullable = false, length = 20)
    private TriggerKind kind;

    @Column(name = "cron_minute", length = 100)
    private String cronMinute;

    @Column(name = "cron_hour", length = 100)
    private String cronHour;

    @Column(name = "cron_day", length = 100)
    private String cronDay;

    @Column(name = "cron_month", length = 100)
    private String cronMonth;

    @Column(name = "cron_day_of_week", length = 100)
    private String cronDayOfWeek;

    @Column(name = "interval_unit", length = 20)
    private String intervalUnit;

    @Column(name = "interval_value")
    private Integer intervalValue;

    /**
     * Wall-clock anchor in {@link #timezone}
     */
    @Column(name = "anchor_time")
    private LocalDateTime anchorTime;

    @Column(name = "timezone", length = 64)
    private String timezone;

    public static TriggerDefinition of(TriggerSpec spec) {
        var definition = new TriggerDefinition();
        definition.apply(spec);
        return definition;
    }

    /**
     * Replace the stored trigger, clearing the columns of the other representation
     */
    public void apply(TriggerSpec spec) {
        this.kind = spec.getKind();
        this.timezone = spec.getTimezone();

        if (spec instanceof CronSpec cron) {
            this.cronMinute = cron.getMinute();
            this.cronHour = cron.getHour();
            this.cronDay = cron.getDay();
            this.cronMonth = cron.getMonth();
            this.cronDayOfWeek = cron.getWeekday();
            this.intervalUnit = null;
            this.intervalValue = null;
            this.anchorTime = null;
        } else if (spec instanceof IntervalSpec interval) {
            this.intervalUnit = interval.getUnit();
            this.intervalValue = interval.getValue();
            this.anchorTime = interval.getAnchorTime();
            this.cronMinute = null;
            this.cronHour = null;
            this.cronDay = null;
            this.cronMonth = null;
            this.cronDayOfWeek = null;
        } else {
            throw new IllegalArgumentException("Unsupported trigger spec: " + spec.getClass().getSimpleName());
        }
    }

    public TriggerSpec toSpec() {
        if (kind == TriggerKind.INTERVAL) {
            return IntervalSpec.builder()
                    .unit(intervalUnit)
                    .value(intervalValue)
                    .anchorTime(anchorTime)
                    .timezone(timezone)
                    .build();
        }
        return CronSpec.builder()
                .minute(cronMinute)
                .hour(cronHour)
                .day(cronDay)
                .month(cronMonth)
                .weekday(cronDayOfWeek)
                .timezone(timezone)
                .build();
    }

    /**
     * Human readable form, e.g. {@code cron[0 9 * * 1]} or {@code interval[14 days]}
     */
    public String describe() {
        if (kind == TriggerKind.INTERVAL) {
            return "interval[" + intervalValue + " " + intervalUnit + (anchorTime != null ? " from " + anchorTime : "") + "]";
        }
        return "cron[" + String.join(" ", String.valueOf(cronMinute), String.valueOf(cronHour),
                String.valueOf(cronDay), String.valueOf(cronMonth), String.valueOf(cronDayOfWeek)) + "]";
    }
}
