package com.pgcrond.jobs;

import com.pgcrond.core.JobContext;
import com.pgcrond.core.JobFailedException;
import com.pgcrond.core.VariableSet;
import com.pgcrond.exec.ProcessResult;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

// Job that runs its command through /bin/sh with the resolved PG* variables (and PGPASSFILE
// when a password file is configured) in the environment
public class ShellJob implements JobHandler {
    private static final Logger logger = Logger.getLogger(ShellJob.class.getName());

    private static final String SHELL = "/bin/sh";
    private static final List<String> EXPORTED = List.of(
            VariableSet.PGHOST, VariableSet.PGPORT, VariableSet.PGDATABASE, VariableSet.PGUSER);

    @Override
    public String execute(JobContext context) throws JobFailedException {
        List<String> argv = List.of(SHELL, "-c", context.getEntry().getCommand());
        try {
            ProcessResult result = context.getProcessRunner().run(argv, buildEnvironment(context.getVariables(), context.getPasswordFile()), null);
            logger.fine("Shell command on line " + context.getEntry().getLineNumber()
                    + " exited with " + result.getExitCode());
            return result.getOutput();
        } catch (IOException e) {
            throw new JobFailedException("Error executing shell command: " + e.getMessage(), e);
        }
    }

    public static Map<String, String> buildEnvironment(VariableSet variables, Path passwordFile) {
        Map<String, String> env = new LinkedHashMap<>();
        for (String name : EXPORTED) {
            if (variables.isSet(name)) {
                env.put(name, variables.get(name));
            }
        }
        if (passwordFile != null) {
            env.put(VariableSet.PGPASSFILE, passwordFile.toString());
        }
        return env;
    }
}
