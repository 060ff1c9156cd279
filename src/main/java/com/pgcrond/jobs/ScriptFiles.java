package com.pgcrond.jobs;

import com.pgcrond.core.JobContext;
import com.pgcrond.core.JobFailedException;

import java.nio.file.Files;
import java.nio.file.Path;

// Shared file lookup for job types whose command names a file
final class ScriptFiles {

    private ScriptFiles() {
    }

    static Path requireReadable(JobContext context, String failureMessage) throws JobFailedException {
        Path file = context.resolveScriptPath();
        if (!Files.isRegularFile(file) || !Files.isReadable(file)) {
            throw new JobFailedException(failureMessage);
        }
        return file;
    }
}
