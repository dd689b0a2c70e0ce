package com.example.reportscheduler.mapper;

import com.example.reportscheduler.domain.entity.ScheduledTask;
import com.example.reportscheduler.domain.entity.TaskExecution;
import com.example.reportscheduler.domain.entity.TriggerDefinition;
import com.example.reportscheduler.domain.enums.TriggerKind;
import com.example.reportscheduler.dto.ScheduleResponse;
import com.example.reportscheduler.dto.TaskExecutionResponse;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

import java.util.List;

/**
 * MapStruct mapper for converting between entities and DTOs
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface ScheduleMapper {

    /**
     * Convert ScheduledTask entity to ScheduleResponse DTO, without execution history
     */
    @Mapping(target = "triggerKind", source = "trigger.kind")
    @Mapping(target = "cronExpression", expression = "java(cronExpressionOf(task.getTrigger()))")
    @Mapping(target = "intervalUnit", source = "trigger.intervalUnit")
    @Mapping(target = "intervalValue", source = "trigger.intervalValue")
    @Mapping(target = "anchorTime", source = "trigger.anchorTime")
    @Mapping(target = "timezone", source = "trigger.timezone")
    @Mapping(target = "triggerDescription", expression = "java(task.getTrigger() != null ? task.getTrigger().describe() : null)")
    @Mapping(target = "recentExecutions", ignore = true)
    ScheduleResponse toResponse(ScheduledTask task);

    TaskExecutionResponse toExecutionResponse(TaskExecution execution);

    List<TaskExecutionResponse> toExecutionResponses(List<TaskExecution> executions);

    default String cronExpressionOf(TriggerDefinition trigger) {
        if (trigger == null || trigger.getKind() != TriggerKind.CRON) {
            return null;
        }
        return String.join(" ", trigger.getCronMinute(), trigger.getCronHour(), trigger.getCronDay(),
                trigger.getCronMonth(), trigger.getCronDayOfWeek());
    }
}
