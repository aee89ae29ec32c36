package com.hostprobe.core.exec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolves a bare command name against the configured search path, the way a shell would,
 * but without ever invoking a shell.
 */
@Component
public class ExecutableLocator {

    private static final Logger log = LoggerFactory.getLogger(ExecutableLocator.class);

    private final List<Path> directories;

    @Autowired
    public ExecutableLocator(ExecutionProperties properties) {
        this(properties.effectiveSearchPath());
    }

    ExecutableLocator(String searchPath) {
        var dirs = new ArrayList<Path>();
        for (String entry : searchPath.split(File.pathSeparator)) {
            if (entry.isBlank()) {
                continue;
            }
            try {
                Path dir = Path.of(entry);
                if (dir.isAbsolute()) {
                    dirs.add(dir);
                }
            } catch (InvalidPathException e) {
                log.debug("Skipping unusable search path entry '{}': {}", entry, e.getReason());
            }
        }
        this.directories = List.copyOf(dirs);
    }

    public Optional<Path> locate(String command) {
        if (command == null || command.isBlank()
                || command.contains("/") || command.contains(File.separator)) {
            return Optional.empty();
        }
        for (Path dir : directories) {
            Path candidate = dir.resolve(command);
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    public List<Path> directories() {
        return directories;
    }
}
