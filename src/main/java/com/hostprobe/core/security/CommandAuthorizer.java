package com.hostprobe.core.security;

import com.hostprobe.core.metrics.ProbeMetrics;
import com.hostprobe.core.model.ErrorKind;
import com.hostprobe.core.policy.ArgumentRule;
import com.hostprobe.core.policy.CommandPolicy;
import com.hostprobe.core.policy.PolicyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether a command invocation may run.
 * <p>
 * Pure decision procedure over the {@link PolicyStore}: no side effects besides logging and
 * metrics, and no process is ever started here. Checks run in this order:
 * <ol>
 *   <li>the command must be whitelisted, compared exactly</li>
 *   <li>global argument checks: count, length, control characters and shell metacharacters</li>
 *   <li>for each argument token in order: multi-token subcommand blocks starting at that
 *       token, then exact blocks, short-flag clusters and prefix blocks</li>
 * </ol>
 * The first violation wins.
 */
@Service
public class CommandAuthorizer {

    private static final Logger log = LoggerFactory.getLogger(CommandAuthorizer.class);

    private final PolicyStore policyStore;
    private final ProbeMetrics metrics;

    public CommandAuthorizer(PolicyStore policyStore, ProbeMetrics metrics) {
        this.policyStore = policyStore;
        this.metrics = metrics;
    }

    public Authorization authorize(String command, List<String> args) {
        Authorization result = evaluate(command, args);
        if (result.isApproved()) {
            metrics.recordApproval();
            log.debug("Approved {} with {} argument(s)", command, result.approval().args().size());
        } else {
            Rejection rejection = result.rejection();
            metrics.recordRejection(rejection.kind());
            log.info("Rejected command '{}': {} ({})", command, rejection.kind(), rejection.detail());
        }
        return result;
    }

    private Authorization evaluate(String command, List<String> args) {
        if (command == null || command.isBlank()) {
            return reject(ErrorKind.MALFORMED_ARGUMENT, "Command name is empty", null);
        }
        Optional<CommandPolicy> found = policyStore.commandPolicy(command);
        if (found.isEmpty()) {
            return reject(ErrorKind.UNAUTHORIZED_COMMAND,
                    "Command '" + command + "' is not in the whitelist", null);
        }
        if (args == null) {
            return reject(ErrorKind.MALFORMED_ARGUMENT, "Argument list is missing", null);
        }
        CommandPolicy policy = found.get();
        // List.copyOf throws on null entries, which checkGlobal reports instead
        List<String> snapshot = Collections.unmodifiableList(new ArrayList<>(args));

        Rejection global = checkGlobal(snapshot);
        if (global != null) {
            return Authorization.rejected(global);
        }

        for (int i = 0; i < snapshot.size(); i++) {
            Rejection rejection = checkToken(policy, snapshot, i);
            if (rejection != null) {
                return Authorization.rejected(rejection);
            }
        }
        return Authorization.approved(new Approval(command, snapshot, policy));
    }

    private Rejection checkGlobal(List<String> args) {
        if (args.size() > policyStore.maxArguments()) {
            return new Rejection(ErrorKind.MALFORMED_ARGUMENT,
                    "Too many arguments: " + args.size() + " (max " + policyStore.maxArguments() + ")", null);
        }
        for (String arg : args) {
            if (arg == null) {
                return new Rejection(ErrorKind.MALFORMED_ARGUMENT, "Argument list contains a null entry", null);
            }
            if (arg.length() > policyStore.maxArgumentLength()) {
                return new Rejection(ErrorKind.MALFORMED_ARGUMENT,
                        "Argument exceeds " + policyStore.maxArgumentLength() + " characters", null);
            }
            for (int j = 0; j < arg.length(); j++) {
                char c = arg.charAt(j);
                if (Character.isISOControl(c)) {
                    return new Rejection(ErrorKind.MALFORMED_ARGUMENT,
                            "Argument '" + printable(arg) + "' contains a control character", null);
                }
                if (policyStore.forbiddenCharacters().contains(c)) {
                    return new Rejection(ErrorKind.MALFORMED_ARGUMENT,
                            "Argument '" + arg + "' contains forbidden character '" + c + "'", null);
                }
            }
        }
        return null;
    }

    private Rejection checkToken(CommandPolicy policy, List<String> args, int index) {
        String token = args.get(index);

        for (ArgumentRule.SubcommandBlock rule : policy.rulesOf(ArgumentRule.SubcommandBlock.class)) {
            if (rule.matchesAt(args, index)) {
                return argumentRejected(policy, String.join(" ", rule.tokens()), rule);
            }
        }

        for (ArgumentRule.ExactBlock rule : policy.rulesOf(ArgumentRule.ExactBlock.class)) {
            if (token.equals(rule.token()) || isAssignmentOf(token, rule.token())) {
                return argumentRejected(policy, token, rule);
            }
        }

        if (isShortFlagCluster(token)) {
            for (ArgumentRule.CharClusterBlock rule : policy.rulesOf(ArgumentRule.CharClusterBlock.class)) {
                for (int j = 1; j < token.length(); j++) {
                    if (rule.bans(token.charAt(j))) {
                        return argumentRejected(policy, token, rule);
                    }
                }
            }
        }

        for (ArgumentRule.PrefixBlock rule : policy.rulesOf(ArgumentRule.PrefixBlock.class)) {
            if (token.startsWith(rule.prefix())) {
                return argumentRejected(policy, token, rule);
            }
        }
        return null;
    }

    /** {@code --filter=x} is treated as {@code --filter}. */
    private static boolean isAssignmentOf(String token, String blocked) {
        return blocked.startsWith("-") && token.startsWith(blocked + "=");
    }

    private static boolean isShortFlagCluster(String token) {
        return token.length() > 1 && token.charAt(0) == '-' && token.charAt(1) != '-';
    }

    private static Rejection argumentRejected(CommandPolicy policy, String token, ArgumentRule rule) {
        return new Rejection(ErrorKind.ARGUMENT_REJECTED,
                "Argument '" + token + "' is blocked for " + policy.name() + " by " + rule.describe(), rule);
    }

    private static Authorization reject(ErrorKind kind, String detail, ArgumentRule rule) {
        return Authorization.rejected(new Rejection(kind, detail, rule));
    }

    private static String printable(String arg) {
        var sb = new StringBuilder();
        for (char c : arg.toCharArray()) {
            sb.append(Character.isISOControl(c) ? String.format("\\u%04x", (int) c) : String.valueOf(c));
        }
        return sb.toString();
    }
}
