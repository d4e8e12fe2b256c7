package com.whereq.foundry.executor;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Starts worker processes. Tests swap in scripted processes through this seam.
 */
public interface ProcessLauncher {
    /**
     * Start a worker with stdout and stderr merged into one stream.
     *
     * @param command full command line, executable first
     * @param workingDirectory directory the worker runs in
     * @return the started process
     * @throws IOException if the executable cannot be started
     */
    Process launch(List<String> command, Path workingDirectory) throws IOException;
}
