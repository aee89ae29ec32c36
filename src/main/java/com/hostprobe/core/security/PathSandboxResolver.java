package com.hostprobe.core.security;

import com.hostprobe.core.metrics.ProbeMetrics;
import com.hostprobe.core.model.ErrorKind;
import com.hostprobe.core.policy.CanonicalPaths;
import com.hostprobe.core.policy.PathPolicy;
import com.hostprobe.core.policy.PolicyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;

/**
 * Canonicalizes requested paths and checks them against the sandbox roots.
 * <p>
 * Only metadata is queried here; file content is never opened.
 */
@Service
public class PathSandboxResolver {

    private static final Logger log = LoggerFactory.getLogger(PathSandboxResolver.class);

    private final PolicyStore policyStore;
    private final ProbeMetrics metrics;

    public PathSandboxResolver(PolicyStore policyStore, ProbeMetrics metrics) {
        this.policyStore = policyStore;
        this.metrics = metrics;
    }

    public PathCheck resolve(String requestedPath) {
        PathCheck check = doResolve(requestedPath, policyStore.pathPolicy());
        PathError error = check.accessError();
        metrics.recordPathResolution(error == null ? null : error.kind());
        if (error != null && error.kind() == ErrorKind.PATH_OUTSIDE_SANDBOX) {
            log.info("Refused path outside sandbox: {}", error.detail());
        }
        return check;
    }

    private PathCheck doResolve(String requestedPath, PathPolicy policy) {
        if (requestedPath == null || requestedPath.isBlank()) {
            return PathCheck.failed(new PathError(ErrorKind.INVALID_PATH, "Path is empty"));
        }
        if (requestedPath.indexOf('\0') >= 0) {
            return PathCheck.failed(new PathError(ErrorKind.INVALID_PATH, "Path contains a NUL character"));
        }

        Path canonical;
        try {
            canonical = CanonicalPaths.canonicalize(Path.of(requestedPath));
        } catch (InvalidPathException e) {
            return PathCheck.failed(new PathError(ErrorKind.INVALID_PATH, "Invalid path: " + e.getReason()));
        } catch (IOException e) {
            log.debug("Canonicalization failed for {}", requestedPath, e);
            return PathCheck.failed(new PathError(ErrorKind.PATH_STAT_FAILED, describe(e)));
        }

        if (!policy.contains(canonical)) {
            return PathCheck.of(new PathResolution(canonical.toString(), false, false, false, false));
        }

        try {
            BasicFileAttributes attrs = Files.readAttributes(canonical, BasicFileAttributes.class,
                    LinkOption.NOFOLLOW_LINKS);
            boolean readable = Files.isReadable(canonical);
            return PathCheck.of(new PathResolution(canonical.toString(), true, attrs.isRegularFile(), readable, true));
        } catch (NoSuchFileException e) {
            return PathCheck.of(new PathResolution(canonical.toString(), false, false, false, true));
        } catch (IOException e) {
            log.debug("Stat failed for {}", canonical, e);
            return PathCheck.failed(new PathError(ErrorKind.PATH_STAT_FAILED, describe(e)));
        }
    }

    private static String describe(IOException e) {
        String reason = e.getMessage();
        return reason == null ? e.getClass().getSimpleName() : reason;
    }
}
