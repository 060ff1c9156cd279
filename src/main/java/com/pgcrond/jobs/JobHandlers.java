package com.pgcrond.jobs;

import com.pgcrond.core.JobType;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Maps every job type to the handler that runs it.
 *
 * <p>{@link #defaults()} wires the production handlers. Tests and embedders can
 * replace single handlers with {@link #with(JobType, JobHandler)}.</p>
 */
public final class JobHandlers {
    private final Map<JobType, JobHandler> handlers;

    private JobHandlers(Map<JobType, JobHandler> handlers) {
        this.handlers = handlers;
    }

    public static JobHandlers defaults() {
        Map<JobType, JobHandler> handlers = new EnumMap<>(JobType.class);
        handlers.put(JobType.DIRECT, new DirectJob());
        handlers.put(JobType.PSQL, new PsqlJob());
        handlers.put(JobType.EMBEDDED_SCRIPT, new ScriptJob());
        handlers.put(JobType.SHELL, new ShellJob());
        return new JobHandlers(handlers);
    }

    /**
     * Return a copy with the handler for one type replaced.
     */
    public JobHandlers with(JobType type, JobHandler handler) {
        Map<JobType, JobHandler> copy = new EnumMap<>(handlers);
        copy.put(type, Objects.requireNonNull(handler, "handler"));
        return new JobHandlers(copy);
    }

    public JobHandler forType(JobType type) {
        JobHandler handler = handlers.get(type);
        if (handler == null) {
            throw new IllegalStateException("No handler registered for job type " + type);
        }
        return handler;
    }
}
