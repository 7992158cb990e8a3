package com.scout.executor.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Spawns an OS process. Separated out so tests can hand back a fake process.
 */
@FunctionalInterface
public interface ProcessLauncher {

    Process launch(List<String> command, Path cwd) throws IOException;

    /**
     * Launcher backed by {@link ProcessBuilder}. Output is discarded; stdin
     * stays a pipe so the message can be written to it.
     */
    static ProcessLauncher system() {
        return (command, cwd) -> new ProcessBuilder(command)
                .directory(cwd.toFile())
                .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                .redirectError(ProcessBuilder.Redirect.DISCARD)
                .start();
    }
}
