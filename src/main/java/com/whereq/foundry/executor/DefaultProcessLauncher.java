package com.whereq.foundry.executor;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Launches workers with {@link ProcessBuilder}.
 *
 * @author WhereQ Inc.
 */
@Slf4j
public class DefaultProcessLauncher implements ProcessLauncher {

    @Override
    public Process launch(List<String> command, Path workingDirectory) throws IOException {
        log.info("Executing command: {}", String.join(" ", command));

        ProcessBuilder processBuilder = new ProcessBuilder(command);
        if (workingDirectory != null) {
            processBuilder.directory(workingDirectory.toFile());
        }
        // progress bars are written to stderr
        processBuilder.redirectErrorStream(true);

        return processBuilder.start();
    }
}
