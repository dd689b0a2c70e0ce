package com.example.reportscheduler.service.trigger;

import com.example.reportscheduler.domain.enums.TriggerKind;

/**
 * Description of when a schedule fires. Implemented by {@link CronSpec} and {@link IntervalSpec}.
 */
public interface TriggerSpec {

    TriggerKind getKind();

    /**
     * IANA zone id the spec is evaluated in, null for the service default
     */
    String getTimezone();
}
