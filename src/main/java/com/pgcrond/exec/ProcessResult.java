package com.pgcrond.exec;

// Exit status and combined stdout+stderr of a finished subprocess
public final class ProcessResult {
    private final int exitCode;
    private final String output;

    public ProcessResult(int exitCode, String output) {
        this.exitCode = exitCode;
        this.output = output == null ? "" : output;
    }

    public int getExitCode() {
        return exitCode;
    }

    /**
     * Get the captured output, never null.
     */
    public String getOutput() {
        return output;
    }

    @Override
    public String toString() {
        return "ProcessResult{exitCode=" + exitCode + ", output=" + output.length() + " chars}";
    }
}
