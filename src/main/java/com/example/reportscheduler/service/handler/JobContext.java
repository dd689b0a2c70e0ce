package com.example.reportscheduler.service.handler;

import com.example.reportscheduler.domain.entity.ScheduledTask;
import com.example.reportscheduler.domain.enums.DateRangeKind;
import com.example.reportscheduler.domain.enums.JobType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Everything a handler needs to run one fire of a schedule.
 * <p>
 * Installed triggers store these values as a JSON argument map, so a handler never has to read the schedule table.
 */
@Value
@Builder(toBuilder = true)
public class JobContext {

    static final String ARG_NAME = "name";
    static final String ARG_DATE_RANGE = "dateRangeKind";
    static final String ARG_RECIPIENTS = "recipients";
    static final String ARG_BYPASS_OPT_IN = "bypassOptIn";
    static final String ARG_ATTACH_ARTIFACT = "attachArtifact";
    static final String ARG_EMPLOYEE_REF = "employeeRef";
    static final String ARG_TIMEZONE = "timezone";

    UUID scheduleId;
    JobType jobType;
    String name;
    DateRangeKind dateRangeKind;
    @Builder.Default
    List<String> recipients = List.of();
    boolean bypassOptIn;
    boolean attachArtifact;
    String employeeRef;
    String timezone;

    /**
     * Fire time the trigger was due at, null when run outside the scheduler
     */
    Instant scheduledFireTime;

    public static JobContext of(ScheduledTask task) {
        return JobContext.builder()
                .scheduleId(task.getId())
                .jobType(task.getJobType())
                .name(task.getName())
                .dateRangeKind(task.getDateRangeKind())
                .recipients(task.getRecipients() != null ? List.copyOf(task.getRecipients()) : List.of())
                .bypassOptIn(task.isBypassOptIn())
                .attachArtifact(task.isAttachArtifact())
                .employeeRef(task.getEmployeeRef())
                .timezone(task.getTimezone())
                .build();
    }

    /**
     * Rebuild a context from the argument map stored with an installed trigger
     */
    public static JobContext fromArgs(UUID scheduleId, JobType jobType, Map<String, Object> args, Instant fireTime) {
        var values = args != null ? args : Map.<String, Object>of();
        var dateRange = (String) values.get(ARG_DATE_RANGE);

        var recipients = new ArrayList<String>();
        if (values.get(ARG_RECIPIENTS) instanceof List<?> list) {
            list.stream().filter(v -> v != null).map(Object::toString).forEach(recipients::add);
        }

        return JobContext.builder()
                .scheduleId(scheduleId)
                .jobType(jobType)
                .name((String) values.get(ARG_NAME))
                .dateRangeKind(dateRange != null ? DateRangeKind.fromCode(dateRange) : null)
                .recipients(List.copyOf(recipients))
                .bypassOptIn(Boolean.TRUE.equals(values.get(ARG_BYPASS_OPT_IN)))
                .attachArtifact(Boolean.TRUE.equals(values.get(ARG_ATTACH_ARTIFACT)))
                .employeeRef((String) values.get(ARG_EMPLOYEE_REF))
                .timezone((String) values.get(ARG_TIMEZONE))
                .scheduledFireTime(fireTime)
                .build();
    }

    public Map<String, Object> toArgs() {
        var args = new HashMap<String, Object>();
        args.put(ARG_NAME, name);
        args.put(ARG_DATE_RANGE, dateRangeKind != null ? dateRangeKind.getCode() : null);
        args.put(ARG_RECIPIENTS, new ArrayList<>(recipients));
        args.put(ARG_BYPASS_OPT_IN, bypassOptIn);
        args.put(ARG_ATTACH_ARTIFACT, attachArtifact);
        args.put(ARG_EMPLOYEE_REF, employeeRef);
        args.put(ARG_TIMEZONE, timezone);
        return args;
    }
}
