package com.pgcrond.test;

import javax.script.AbstractScriptEngine;
import javax.script.Bindings;
import javax.script.Invocable;
import javax.script.ScriptContext;
import javax.script.ScriptEngineFactory;
import javax.script.ScriptException;
import javax.script.SimpleBindings;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Tiny line-oriented script language for exercising embedded script jobs.
 *
 * <p>A script must start with {@code def run}; every following line is one of:</p>
 * <ul>
 *   <li>{@code echo TEXT} appends TEXT to the output, with {@code ${NAME}} replaced by a variable</li>
 *   <li>{@code sql STATEMENT} runs STATEMENT on the job's connection</li>
 *   <li>{@code fail MESSAGE} raises a ScriptException</li>
 *   <li>{@code crash} raises an IllegalStateException</li>
 * </ul>
 */
public class LineScriptEngine extends AbstractScriptEngine implements Invocable {
    private final ScriptEngineFactory factory;
    private List<String> program = List.of();

    public LineScriptEngine(ScriptEngineFactory factory) {
        this.factory = factory;
    }

    @Override
    public Object eval(String script, ScriptContext context) throws ScriptException {
        program = script.lines().map(String::trim).filter(line -> !line.isEmpty()).collect(Collectors.toList());
        if (program.contains("syntax error")) {
            throw new ScriptException("syntax error in " + get(FILENAME));
        }
        return null;
    }

    @Override
    public Object eval(Reader reader, ScriptContext context) throws ScriptException {
        try (BufferedReader buffered = new BufferedReader(reader)) {
            return eval(buffered.lines().collect(Collectors.joining("\n")), context);
        } catch (IOException e) {
            throw new ScriptException(e);
        }
    }

    @Override
    public Object invokeFunction(String name, Object... args) throws ScriptException, NoSuchMethodException {
        if (program.isEmpty() || !program.get(0).equals("def " + name)) {
            throw new NoSuchMethodException("no function " + name);
        }
        @SuppressWarnings("unchecked")
        Map<String, String> variables = (Map<String, String>) args[0];
        Connection conn = (Connection) args[3];

        List<String> output = new ArrayList<>();
        for (String line : program.subList(1, program.size())) {
            if (line.startsWith("echo ")) {
                output.add(substitute(line.substring(5), variables));
            } else if (line.startsWith("sql ")) {
                try (Statement stmt = conn.createStatement()) {
                    stmt.execute(line.substring(4));
                } catch (SQLException e) {
                    throw new ScriptException(e);
                }
            } else if (line.startsWith("fail ")) {
                throw new ScriptException(line.substring(5));
            } else if (line.equals("crash")) {
                throw new IllegalStateException("script crashed");
            }
        }
        return output.isEmpty() ? null : String.join("\n", output) + "\n";
    }

    @Override
    public Object invokeMethod(Object thiz, String name, Object... args) throws NoSuchMethodException {
        throw new NoSuchMethodException(name);
    }

    @Override
    public <T> T getInterface(Class<T> clasz) {
        return null;
    }

    @Override
    public <T> T getInterface(Object thiz, Class<T> clasz) {
        return null;
    }

    @Override
    public Bindings createBindings() {
        return new SimpleBindings();
    }

    @Override
    public ScriptEngineFactory getFactory() {
        return factory;
    }

    private static String substitute(String text, Map<String, String> variables) {
        String result = text;
        for (Map.Entry<String, String> variable : variables.entrySet()) {
            result = result.replace("${" + variable.getKey() + "}", variable.getValue());
        }
        return result;
    }
}
