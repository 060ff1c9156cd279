package com.pgcrond.test;

import javax.script.ScriptEngine;
import javax.script.ScriptEngineFactory;
import javax.script.ScriptEngineManager;
import java.util.List;

public class LineScriptEngineFactory implements ScriptEngineFactory {
    public static final String EXTENSION = "tst";

    /**
     * Create a manager that knows the test language under its file extension.
     */
    public static ScriptEngineManager manager() {
        ScriptEngineManager manager = new ScriptEngineManager();
        manager.registerEngineExtension(EXTENSION, new LineScriptEngineFactory());
        return manager;
    }

    @Override
    public String getEngineName() {
        return "line-script";
    }

    @Override
    public String getEngineVersion() {
        return "1.0";
    }

    @Override
    public List<String> getExtensions() {
        return List.of(EXTENSION);
    }

    @Override
    public List<String> getMimeTypes() {
        return List.of();
    }

    @Override
    public List<String> getNames() {
        return List.of("line-script");
    }

    @Override
    public String getLanguageName() {
        return "line-script";
    }

    @Override
    public String getLanguageVersion() {
        return "1.0";
    }

    @Override
    public Object getParameter(String key) {
        switch (key) {
            case ScriptEngine.ENGINE:
            case ScriptEngine.NAME:
            case ScriptEngine.LANGUAGE:
                return "line-script";
            case ScriptEngine.ENGINE_VERSION:
            case ScriptEngine.LANGUAGE_VERSION:
                return "1.0";
            default:
                return null;
        }
    }

    @Override
    public String getMethodCallSyntax(String obj, String m, String... args) {
        return m;
    }

    @Override
    public String getOutputStatement(String toDisplay) {
        return "echo " + toDisplay;
    }

    @Override
    public String getProgram(String... statements) {
        return String.join("\n", statements);
    }

    @Override
    public ScriptEngine getScriptEngine() {
        return new LineScriptEngine(this);
    }
}
