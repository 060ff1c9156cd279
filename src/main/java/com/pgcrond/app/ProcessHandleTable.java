package com.pgcrond.app;

import java.util.Optional;

// ProcessTable backed by java.lang.ProcessHandle; signal() sends SIGTERM
public class ProcessHandleTable implements ProcessTable {

    @Override
    public boolean isLive(long pid) {
        Optional<ProcessHandle> handle = ProcessHandle.of(pid);
        return handle.isPresent() && handle.get().isAlive();
    }

    @Override
    public boolean signal(long pid) {
        return ProcessHandle.of(pid).map(ProcessHandle::destroy).orElse(false);
    }

    @Override
    public long currentPid() {
        return ProcessHandle.current().pid();
    }
}
