package com.pgcrond.jobs;

import com.pgcrond.core.JobContext;
import com.pgcrond.core.JobFailedException;
import com.pgcrond.core.ResolvedDsn;
import com.pgcrond.core.VariableSet;
import com.pgcrond.exec.ProcessResult;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Job that feeds a session file to the psql client.
 *
 * <p>The command names the file, absolute or relative to {@code SCRIPTHOME}. psql is
 * started as {@code PSQL -U user -d database [-h server] [-p port] -f file}. The host
 * is only passed for servers other than {@code localhost}, so local jobs connect over
 * the Unix socket. A schema list becomes {@code PGOPTIONS=-c search_path=...}.</p>
 *
 * <p>psql reads the password store itself, so no password is passed. A configured
 * password file is handed over as {@code PGPASSFILE}.</p>
 */
public class PsqlJob implements JobHandler {
    private static final Logger logger = Logger.getLogger(PsqlJob.class.getName());

    @Override
    public String execute(JobContext context) throws JobFailedException {
        Path file = ScriptFiles.requireReadable(context, "Invalid PostgreSQL session file provided");
        List<String> argv = buildCommand(context, file);

        try {
            ProcessResult result = context.getProcessRunner().run(argv, buildEnvironment(context.getDsn(), context.getPasswordFile()), null);
            logger.fine("psql " + file + " exited with " + result.getExitCode());
            return result.getOutput();
        } catch (IOException e) {
            throw new JobFailedException("Error running psql: " + e.getMessage(), e);
        }
    }

    public static List<String> buildCommand(JobContext context, Path file) {
        ResolvedDsn dsn = context.getDsn();
        List<String> argv = new ArrayList<>();
        argv.add(context.getVariables().getOrDefault(VariableSet.PSQL, VariableSet.DEFAULT_PSQL));
        argv.add("-U");
        argv.add(dsn.getUsername());
        argv.add("-d");
        argv.add(dsn.getDatabase());
        if (!ResolvedDsn.DEFAULT_SERVER.equals(dsn.getServer())) {
            argv.add("-h");
            argv.add(dsn.getServer());
        }
        if (dsn.getPort().isPresent()) {
            argv.add("-p");
            argv.add(dsn.getPort().get());
        }
        argv.add("-f");
        argv.add(file.toString());
        return argv;
    }

    private static Map<String, String> buildEnvironment(ResolvedDsn dsn, Path passwordFile) {
        Map<String, String> env = new HashMap<>();
        if (!dsn.getSchemas().isEmpty()) {
            env.put("PGOPTIONS", "-c search_path=" + String.join(",", dsn.getSchemas()));
        }
        if (passwordFile != null) {
            env.put(VariableSet.PGPASSFILE, passwordFile.toString());
        }
        return env;
    }
}
