package com.hostprobe.core.policy;

import java.io.IOException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Canonicalization shared by the sandbox roots and the requested paths.
 */
public final class CanonicalPaths {

    /** Same bound the kernel applies before failing with ELOOP. */
    private static final int MAX_LINK_DEPTH = 40;

    private CanonicalPaths() {}

    /**
     * Resolves {@code path} to an absolute form with {@code .}, {@code ..} and symlinks removed.
     * <p>
     * The path is walked one segment at a time, the way the kernel does: a symlink is replaced
     * by its target before the next segment is applied, so {@code link/..} is the parent of
     * the link's target, not the directory holding the link. Segments that do not exist are
     * kept as they are, like {@code realpath -m}. A dangling symlink is followed to where it
     * points, so it cannot be used to pass the containment check for a location outside the
     * sandbox.
     *
     * @throws IOException when a symlink cannot be read (e.g. permission denied) or the
     *                     chain of links is too deep
     */
    public static Path canonicalize(Path path) throws IOException {
        return walk(path.toAbsolutePath(), new int[1]);
    }

    private static Path walk(Path absolute, int[] links) throws IOException {
        Path current = absolute.getRoot();
        for (Path name : absolute) {
            String segment = name.toString();
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                Path parent = current.getParent();
                current = parent == null ? current : parent;
                continue;
            }
            Path next = current.resolve(segment);
            if (Files.isSymbolicLink(next)) {
                if (++links[0] > MAX_LINK_DEPTH) {
                    throw new FileSystemException(absolute.toString(), null, "Too many levels of symbolic links");
                }
                current = walk(current.resolve(Files.readSymbolicLink(next)), links);
            } else {
                current = next;
            }
        }
        return current;
    }
}
