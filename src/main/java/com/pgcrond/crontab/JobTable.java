package com.pgcrond.crontab;

import com.pgcrond.core.JobEntry;
import com.pgcrond.core.VariableSet;

import java.util.List;
import java.util.Objects;

// Result of one parse of the job table: its variables and its entries in file order
public final class JobTable {
    private final VariableSet variables;
    private final List<JobEntry> entries;

    public JobTable(VariableSet variables, List<JobEntry> entries) {
        this.variables = Objects.requireNonNull(variables, "variables");
        this.entries = List.copyOf(entries);
    }

    public VariableSet getVariables() {
        return variables;
    }

    public List<JobEntry> getEntries() {
        return entries;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof JobTable)) {
            return false;
        }
        JobTable other = (JobTable) o;
        return variables.equals(other.variables) && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variables, entries);
    }
}
