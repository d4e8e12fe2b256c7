package com.whereq.foundry.support;

import com.whereq.foundry.executor.ProcessLauncher;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Hands out prepared processes in order and records every launch.
 */
public final class StubProcessLauncher implements ProcessLauncher {

    private final Deque<Process> processes = new ArrayDeque<>();
    private final List<List<String>> commands = new ArrayList<>();
    private IOException failure;

    public StubProcessLauncher willLaunch(Process process) {
        processes.add(process);
        return this;
    }

    public StubProcessLauncher willFail(IOException failure) {
        this.failure = failure;
        return this;
    }

    public synchronized List<List<String>> getCommands() {
        return List.copyOf(commands);
    }

    @Override
    public synchronized Process launch(List<String> command, Path workingDirectory) throws IOException {
        commands.add(List.copyOf(command));
        if (failure != null) {
            throw failure;
        }
        Process next = processes.poll();
        if (next == null) {
            throw new IllegalStateException("No scripted process left for " + command);
        }
        return next;
    }
}
