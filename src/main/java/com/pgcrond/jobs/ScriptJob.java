package com.pgcrond.jobs;

import com.pgcrond.core.JobContext;
import com.pgcrond.core.JobFailedException;

import javax.script.Invocable;
import javax.script.ScriptEngine;
import javax.script.ScriptEngineManager;
import javax.script.ScriptException;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.logging.Logger;

/**
 * Job that loads a script and calls its entry point with a live connection.
 *
 * <p>The command names the script file, absolute or relative to {@code SCRIPTHOME}.
 * The script language is chosen by file extension among the JSR-223 engines on the
 * classpath; the build ships the Nashorn JavaScript engine, so {@code .js} scripts
 * always run. After evaluating the file, its {@value #ENTRY_POINT} function is called
 * with four arguments:</p>
 * <ol>
 *   <li>the job's variables, as a {@code Map<String, String>}</li>
 *   <li>the {@link com.pgcrond.core.ResolvedDsn}</li>
 *   <li>the {@link com.pgcrond.core.JobEntry}</li>
 *   <li>an open {@link Connection} in autocommit mode</li>
 * </ol>
 *
 * <p>The string form of the return value is the job's output; {@code null} means no
 * output. The connection is closed when the function returns.</p>
 */
public class ScriptJob implements JobHandler {
    private static final Logger logger = Logger.getLogger(ScriptJob.class.getName());

    public static final String ENTRY_POINT = "run";
    private static final String FAILURE_PREFIX = "Error executing Perl script: ";

    private final ScriptEngineManager engineManager;

    public ScriptJob() {
        this(new ScriptEngineManager());
    }

    public ScriptJob(ScriptEngineManager engineManager) {
        this.engineManager = engineManager;
    }

    @Override
    public String execute(JobContext context) throws JobFailedException {
        Path file = ScriptFiles.requireReadable(context, "Invalid Perl script file provided");
        ScriptEngine engine = findEngine(file);

        Connection conn;
        try {
            conn = context.openConnection();
        } catch (SQLException e) {
            throw new JobFailedException("Unable to connect to database: " + e.getMessage(), e);
        }

        try (conn; Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            engine.put(ScriptEngine.FILENAME, file.toString());
            engine.eval(reader);
            Object result = ((Invocable) engine).invokeFunction(ENTRY_POINT,
                    context.getVariables().asMap(), context.getDsn(), context.getEntry(), conn);
            logger.fine("Script " + file + " returned " + (result == null ? "nothing" : "output"));
            return result == null ? "" : result.toString();
        } catch (ScriptException | NoSuchMethodException | IOException | SQLException e) {
            throw new JobFailedException(FAILURE_PREFIX + e.getMessage(), e);
        } catch (RuntimeException e) {
            // Faults raised inside the script body surface as unchecked exceptions
            throw new JobFailedException(FAILURE_PREFIX + e, e);
        }
    }

    private ScriptEngine findEngine(Path file) throws JobFailedException {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        ScriptEngine engine = dot < 0 ? null : engineManager.getEngineByExtension(name.substring(dot + 1));
        if (engine == null) {
            throw new JobFailedException(FAILURE_PREFIX + "no script engine available for " + name);
        }
        if (!(engine instanceof Invocable)) {
            throw new JobFailedException(FAILURE_PREFIX + "script engine for " + name
                    + " cannot call " + ENTRY_POINT);
        }
        return engine;
    }
}
