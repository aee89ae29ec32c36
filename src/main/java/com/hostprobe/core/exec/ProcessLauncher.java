package com.hostprobe.core.exec;

import java.io.IOException;
import java.util.List;

/**
 * Starts a child process. The executor never calls {@link ProcessBuilder} directly, so tests
 * can substitute a counting or failing launcher.
 */
@FunctionalInterface
public interface ProcessLauncher {

    Process launch(List<String> commandLine) throws IOException;

    static ProcessLauncher system() {
        return commandLine -> new ProcessBuilder(commandLine)
                .redirectErrorStream(false)
                .start();
    }
}
