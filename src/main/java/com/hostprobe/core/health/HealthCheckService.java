package com.hostprobe.core.health;

import com.hostprobe.core.exec.ExecutableLocator;
import com.hostprobe.core.policy.PolicyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final PolicyStore policyStore;
    private final ExecutableLocator locator;

    public HealthCheckService(PolicyStore policyStore, ExecutableLocator locator) {
        this.policyStore = policyStore;
        this.locator = locator;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkPolicy());
        results.add(checkSandbox());
        results.add(checkExecutables());
        return results;
    }

    private HealthStatus checkPolicy() {
        int commands = policyStore.commandNames().size();
        if (commands == 0) {
            return new HealthStatus("policy", HealthStatus.Status.DOWN,
                    "No commands whitelisted", Map.of());
        }
        return new HealthStatus("policy", HealthStatus.Status.UP,
                commands + " command(s) whitelisted", Map.of("commands", String.valueOf(commands)));
    }

    private HealthStatus checkSandbox() {
        List<Path> roots = policyStore.pathPolicy().allowedRoots();
        if (roots.isEmpty()) {
            return new HealthStatus("sandbox", HealthStatus.Status.DOWN,
                    "No sandbox roots configured", Map.of());
        }
        long present = roots.stream().filter(Files::isDirectory).count();
        var metadata = Map.of("roots", String.valueOf(roots.size()), "present", String.valueOf(present));
        if (present == 0) {
            return new HealthStatus("sandbox", HealthStatus.Status.DOWN,
                    "None of the " + roots.size() + " sandbox root(s) exist", metadata);
        }
        if (present < roots.size()) {
            return new HealthStatus("sandbox", HealthStatus.Status.DEGRADED,
                    present + " of " + roots.size() + " sandbox root(s) exist", metadata);
        }
        return new HealthStatus("sandbox", HealthStatus.Status.UP,
                "All " + roots.size() + " sandbox root(s) exist", metadata);
    }

    private HealthStatus checkExecutables() {
        var missing = new TreeSet<String>();
        for (String name : policyStore.commandNames()) {
            if (locator.locate(name).isEmpty()) {
                missing.add(name);
            }
        }
        int total = policyStore.commandNames().size();
        if (missing.isEmpty()) {
            return new HealthStatus("executables", HealthStatus.Status.UP,
                    "All " + total + " whitelisted command(s) found", Map.of());
        }
        log.debug("Whitelisted commands missing from search path: {}", missing);
        var status = missing.size() == total ? HealthStatus.Status.DOWN : HealthStatus.Status.DEGRADED;
        return new HealthStatus("executables", status,
                missing.size() + " of " + total + " whitelisted command(s) not found",
                Map.of("missing", String.join(",", missing)));
    }
}
