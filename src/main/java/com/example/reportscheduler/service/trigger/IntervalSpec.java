package com.example.reportscheduler.service.trigger;

import com.example.reportscheduler.domain.enums.TriggerKind;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Fixed-period trigger. With an anchor, fire times are {@code anchor + k * period};
 * without one the period counts from the reference time.
 */
@Value
@Builder
public class IntervalSpec implements TriggerSpec {

    /**
     * One of minutes, hours, days, weeks
     */
    String unit;

    Integer value;

    /**
     * Wall-clock anchor in {@link #timezone}
     */
    LocalDateTime anchorTime;

    String timezone;

    @Override
    public TriggerKind getKind() {
        return TriggerKind.INTERVAL;
    }
}
