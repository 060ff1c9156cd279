package com.pgcrond.core;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Everything an isolated execution unit needs to run one due job.
 *
 * <p>The scheduler builds one snapshot per due entry: a copy of the tick's
 * variables, the entry itself and the minute it was selected for. When the job
 * runs in a child process the snapshot crosses the process boundary as JSON.</p>
 *
 * <p><b>Usage:</b></p>
 * <pre>{@code
 * String json = snapshot.toJson();          // daemon side
 * JobSnapshot copy = JobSnapshot.fromJson(json); // child side
 * }</pre>
 */
public final class JobSnapshot {
    // Shared Gson instance for JSON serialization - thread-safe
    private static final Gson gson = new Gson();

    private final Map<String, String> variables;
    private final JobEntry entry;
    private final String scheduledFor;

    public JobSnapshot(VariableSet variables, JobEntry entry, ZonedDateTime scheduledFor) {
        this.variables = new LinkedHashMap<>(variables.asMap());
        this.entry = Objects.requireNonNull(entry, "entry");
        this.scheduledFor = scheduledFor.toString();
    }

    public VariableSet getVariables() {
        return new VariableSet(variables);
    }

    public JobEntry getEntry() {
        return entry;
    }

    /**
     * Get the tick minute this job was selected for.
     */
    public ZonedDateTime getScheduledFor() {
        return ZonedDateTime.parse(scheduledFor);
    }

    public String toJson() {
        return gson.toJson(this);
    }

    /**
     * Rebuild a snapshot written by {@link #toJson()}.
     *
     * @throws IllegalArgumentException if the text is not a complete snapshot
     */
    public static JobSnapshot fromJson(String json) {
        JobSnapshot snapshot;
        try {
            snapshot = gson.fromJson(json, JobSnapshot.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed job snapshot", e);
        }
        if (snapshot == null || snapshot.entry == null || snapshot.variables == null
                || snapshot.scheduledFor == null) {
            throw new IllegalArgumentException("Incomplete job snapshot");
        }
        return snapshot;
    }

    @Override
    public String toString() {
        return "JobSnapshot{entry=" + entry + ", scheduledFor=" + scheduledFor + "}";
    }
}
