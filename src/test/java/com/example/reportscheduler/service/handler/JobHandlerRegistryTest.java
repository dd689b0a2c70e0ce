package com.example.reportscheduler.service.handler;

import com.example.reportscheduler.domain.enums.JobType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JobHandlerRegistry Tests")
class JobHandlerRegistryTest {

    private static JobHandler handlerFor(JobType type) {
        return new JobHandler() {
            @Override
            public JobType getJobType() {
                return type;
            }

            @Override
            public JobResult execute(JobContext context) {
                return JobResult.success(Map.of());
            }
        };
    }

    private static List<JobHandler> allHandlers() {
        return new ArrayList<>(Arrays.stream(JobType.values()).map(JobHandlerRegistryTest::handlerFor).toList());
    }

    @Test
    @DisplayName("Should register one handler per job type")
    void shouldRegisterAllHandlers() {
        var handlers = allHandlers();
        var registry = new JobHandlerRegistry(handlers);
        registry.initialize();

        assertThat(registry.getRegisteredTypes()).containsExactlyInAnyOrder(JobType.values());
        assertThat(registry.getHandler(JobType.BACKUP)).containsSame(handlers.get(JobType.BACKUP.ordinal()));
        assertThat(registry.hasHandler(JobType.TIP_REPORT)).isTrue();
        assertThat(registry.getHandlerOrThrow(JobType.DAILY_BALANCE_REPORT).getJobType()).isEqualTo(JobType.DAILY_BALANCE_REPORT);
    }

    @Test
    @DisplayName("Should fail startup when a job type has no handler")
    void shouldFailOnMissingHandler() {
        var handlers = allHandlers();
        handlers.remove(JobType.BACKUP.ordinal());
        var registry = new JobHandlerRegistry(handlers);

        assertThatThrownBy(registry::initialize)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("No handler registered")
                .hasMessageContaining("BACKUP");
    }

    @Test
    @DisplayName("Should fail startup on two handlers for one job type")
    void shouldFailOnDuplicateHandler() {
        var handlers = allHandlers();
        handlers.add(handlerFor(JobType.TIP_REPORT));
        var registry = new JobHandlerRegistry(handlers);

        assertThatThrownBy(registry::initialize)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Duplicate handler");
    }

    @Test
    @DisplayName("Should throw for an unregistered type when using getHandlerOrThrow")
    void shouldThrowForUnregisteredType() {
        var registry = new JobHandlerRegistry(List.of());

        assertThat(registry.getHandler(JobType.BACKUP)).isEmpty();
        assertThatThrownBy(() -> registry.getHandlerOrThrow(JobType.BACKUP))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("No handler registered");
    }
}
