package com.example.reportscheduler.dto;

import com.example.reportscheduler.domain.enums.TriggerKind;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Candidate trigger to preview before saving a schedule
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TriggerPreviewRequest {

    @NotNull(message = "Trigger kind is required")
    private TriggerKind triggerKind;

    private String cronExpression;
    private String intervalUnit;
    private Integer intervalValue;
    private LocalDateTime anchorTime;
    private String timezone;
}
