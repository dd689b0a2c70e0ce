package com.example.reportscheduler.service.handler;

import com.example.reportscheduler.domain.enums.JobType;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Registry for job handlers.
 * <p>
 * Discovers all JobHandler beans at startup. Startup fails when a job type has
 * no handler or more than one.
 */
@Slf4j
@Component
public class JobHandlerRegistry {

    private final Map<JobType, JobHandler> handlers = new EnumMap<>(JobType.class);
    private final List<JobHandler> handlerBeans;

    public JobHandlerRegistry(List<JobHandler> handlerBeans) {
        this.handlerBeans = handlerBeans;
    }

    @PostConstruct
    public void initialize() {
        for (var handler : handlerBeans) {
            var type = handler.getJobType();
            if (handlers.containsKey(type)) {
                throw new IllegalStateException(String.format("Duplicate handler for job type %s: %s and %s",
                        type, handlers.get(type).getClass().getSimpleName(), handler.getClass().getSimpleName()));
            }
            handlers.put(type, handler);
            log.info("Registered handler for job type {}: {}", type, handler.getClass().getSimpleName());
        }

        var missing = EnumSet.complementOf(handlers.isEmpty() ? EnumSet.noneOf(JobType.class) : EnumSet.copyOf(handlers.keySet()));
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No handler registered for job type(s): " + missing);
        }
    }

    public Optional<JobHandler> getHandler(JobType jobType) {
        return Optional.ofNullable(handlers.get(jobType));
    }

    /**
     * @throws IllegalArgumentException if no handler is registered
     */
    public JobHandler getHandlerOrThrow(JobType jobType) {
        return getHandler(jobType).orElseThrow(() -> new IllegalArgumentException("No handler registered for job type: " + jobType));
    }

    public boolean hasHandler(JobType jobType) {
        return handlers.containsKey(jobType);
    }

    public Set<JobType> getRegisteredTypes() {
        return Collections.unmodifiableSet(handlers.keySet());
    }
}
