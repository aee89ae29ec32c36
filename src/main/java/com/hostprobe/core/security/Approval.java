package com.hostprobe.core.security;

import com.hostprobe.core.policy.CommandPolicy;

import java.util.List;

/**
 * Proof that a command and its arguments passed authorization.
 * <p>
 * Only {@link CommandAuthorizer} can create one, and the executor only accepts requests
 * built from an approval, so no unauthorized invocation can reach process creation.
 */
public final class Approval {

    private final String command;
    private final List<String> args;
    private final CommandPolicy policy;

    Approval(String command, List<String> args, CommandPolicy policy) {
        this.command = command;
        this.args = List.copyOf(args);
        this.policy = policy;
    }

    public String command() {
        return command;
    }

    public List<String> args() {
        return args;
    }

    public CommandPolicy policy() {
        return policy;
    }

    @Override
    public String toString() {
        return "Approval[" + command + " " + String.join(" ", args) + "]";
    }
}
