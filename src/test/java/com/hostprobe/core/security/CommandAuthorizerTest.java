package com.hostprobe.core.security;

import com.hostprobe.core.metrics.ProbeMetrics;
import com.hostprobe.core.model.ErrorKind;
import com.hostprobe.core.policy.ArgumentRule;
import com.hostprobe.core.policy.PolicyProperties;
import com.hostprobe.core.policy.PolicyStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CommandAuthorizerTest {

    private SimpleMeterRegistry registry;
    private CommandAuthorizer authorizer;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        authorizer = new CommandAuthorizer(PolicyStore.from(new PolicyProperties()), new ProbeMetrics(registry));
    }

    private Authorization authorize(String command, String... args) {
        return authorizer.authorize(command, List.of(args));
    }

    private Rejection rejected(String command, String... args) {
        Authorization result = authorize(command, args);
        assertFalse(result.isApproved(), "expected rejection for " + command + " " + String.join(" ", args));
        return result.rejection();
    }

    @Nested
    @DisplayName("Whitelist")
    class Whitelist {

        @Test
        @DisplayName("approves 'ping -c 5 localhost'")
        void approvesPing() {
            Authorization result = authorize("ping", "-c", "5", "localhost");
            assertTrue(result.isApproved());
            assertEquals("ping", result.approval().command());
            assertEquals(List.of("-c", "5", "localhost"), result.approval().args());
            assertEquals("ping", result.approval().policy().name());
        }

        @Test
        @DisplayName("approves a command with no arguments")
        void approvesNoArgs() {
            assertTrue(authorize("uptime").isApproved());
        }

        @Test
        @DisplayName("rejects commands not in the whitelist")
        void rejectsUnknown() {
            Rejection r = rejected("rm", "-rf", "/");
            assertEquals(ErrorKind.UNAUTHORIZED_COMMAND, r.kind());
            assertNull(r.rule());
        }

        @Test
        @DisplayName("rejects path-qualified and differently cased names")
        void rejectsAliases() {
            assertEquals(ErrorKind.UNAUTHORIZED_COMMAND, rejected("/bin/ping", "localhost").kind());
            assertEquals(ErrorKind.UNAUTHORIZED_COMMAND, rejected("Ping", "localhost").kind());
        }

        @Test
        @DisplayName("blank command name is malformed")
        void blankCommand() {
            assertEquals(ErrorKind.MALFORMED_ARGUMENT, rejected(" ").kind());
            assertEquals(ErrorKind.MALFORMED_ARGUMENT, authorizer.authorize(null, List.of()).rejection().kind());
        }
    }

    @Nested
    @DisplayName("Global argument checks")
    class GlobalChecks {

        @Test
        @DisplayName("rejects shell metacharacters")
        void forbiddenCharacters() {
            for (String arg : List.of("localhost;rm", "a|b", "$(id)", "`id`", "a>b", "a&b")) {
                Rejection r = rejected("ping", arg);
                assertEquals(ErrorKind.MALFORMED_ARGUMENT, r.kind(), arg);
            }
        }

        @Test
        @DisplayName("rejects control characters")
        void controlCharacters() {
            Rejection r = rejected("ping", "local\nhost");
            assertEquals(ErrorKind.MALFORMED_ARGUMENT, r.kind());
            assertTrue(r.detail().contains("\\u000a"));
        }

        @Test
        @DisplayName("rejects too many arguments")
        void tooManyArguments() {
            String[] args = Collections.nCopies(21, "x").toArray(String[]::new);
            assertEquals(ErrorKind.MALFORMED_ARGUMENT, rejected("df", args).kind());
        }

        @Test
        @DisplayName("rejects overlong arguments")
        void tooLong() {
            assertEquals(ErrorKind.MALFORMED_ARGUMENT, rejected("df", "x".repeat(1025)).kind());
        }

        @Test
        @DisplayName("rejects a null argument list or entry")
        void nulls() {
            assertEquals(ErrorKind.MALFORMED_ARGUMENT, authorizer.authorize("df", null).rejection().kind());
            assertEquals(ErrorKind.MALFORMED_ARGUMENT,
                    authorizer.authorize("df", Arrays.asList("-h", null)).rejection().kind());
        }
    }

    @Nested
    @DisplayName("Argument rules")
    class ArgumentRules {

        @Test
        @DisplayName("exact block: 'dig -f queries.txt'")
        void exactBlock() {
            Rejection r = rejected("dig", "-f", "queries.txt");
            assertEquals(ErrorKind.ARGUMENT_REJECTED, r.kind());
            assertEquals(new ArgumentRule.ExactBlock("-f"), r.rule());
            assertEquals("Argument '-f' is blocked for dig by ExactBlock(\"-f\")", r.detail());
        }

        @Test
        @DisplayName("exact block catches the --flag=value form")
        void exactBlockAssignment() {
            Rejection r = rejected("ip", "--b=cmds");
            assertEquals(new ArgumentRule.ExactBlock("--b"), r.rule());
        }

        @Test
        @DisplayName("char cluster: 'ping -cf localhost' is rejected")
        void clusterBlock() {
            Rejection r = rejected("ping", "-cf", "localhost");
            assertEquals(ErrorKind.ARGUMENT_REJECTED, r.kind());
            assertInstanceOf(ArgumentRule.CharClusterBlock.class, r.rule());
        }

        @Test
        @DisplayName("char cluster does not apply to long options")
        void clusterSkipsLongOptions() {
            assertTrue(authorize("ping", "--interval-free", "localhost").isApproved());
            assertTrue(authorize("dig", "+short", "example.com").isApproved());
        }

        @Test
        @DisplayName("prefix block: 'du --files0-from=list'")
        void prefixBlock() {
            Rejection r = rejected("du", "--files0-from=list");
            assertEquals(new ArgumentRule.PrefixBlock("--f"), r.rule());
        }

        @Test
        @DisplayName("prefix block: 'ip -batch' abbreviations")
        void prefixAbbreviation() {
            Rejection r = rejected("ip", "-bat", "cmds");
            assertEquals(new ArgumentRule.PrefixBlock("-ba"), r.rule());
        }

        @Test
        @DisplayName("subcommand block: 'ip netns exec evil sh'")
        void subcommandBlock() {
            Rejection r = rejected("ip", "netns", "exec", "evil", "sh");
            assertEquals(ErrorKind.ARGUMENT_REJECTED, r.kind());
            assertEquals(ArgumentRule.SubcommandBlock.of("netns exec"), r.rule());
            assertTrue(r.detail().contains("'netns exec'"));
        }

        @Test
        @DisplayName("subcommand block matches anywhere in the argument list")
        void subcommandAfterOptions() {
            assertFalse(authorize("ip", "-4", "link", "set", "eth0", "down").isApproved());
        }

        @Test
        @DisplayName("read-only subcommands are approved")
        void readOnlySubcommands() {
            assertTrue(authorize("ip", "addr", "show").isApproved());
            assertTrue(authorize("ip", "-br", "link", "show").isApproved());
            assertTrue(authorize("ip", "route", "get", "10.0.0.1").isApproved());
            assertTrue(authorize("ip", "route").isApproved());
        }

        @Test
        @DisplayName("any netns or exec token is rejected for ip")
        void bareNetnsAndExec() {
            assertEquals(new ArgumentRule.ExactBlock("netns"), rejected("ip", "netns", "list").rule());
            assertEquals(new ArgumentRule.ExactBlock("exec"), rejected("ip", "-4", "exec", "sh").rule());
            assertEquals(new ArgumentRule.ExactBlock("vrf"), rejected("ip", "vrf", "exec", "v", "sh").rule());
        }

        @Test
        @DisplayName("the first violation wins")
        void firstViolationWins() {
            Rejection r = rejected("dig", "-f", "x", "-f");
            assertEquals(new ArgumentRule.ExactBlock("-f"), r.rule());
        }
    }

    @Nested
    @DisplayName("Abbreviated options and subcommands")
    class Abbreviations {

        @Test
        @DisplayName("du: unambiguous abbreviations of --files0-from")
        void duFilesFrom() {
            for (String arg : List.of("--files0=/etc/shadow", "--files0-f", "--fi", "--f")) {
                assertEquals(new ArgumentRule.PrefixBlock("--f"), rejected("du", arg, "/etc/shadow").rule(), arg);
            }
        }

        @Test
        @DisplayName("du: abbreviations of --exclude-from, while --exclude stays allowed")
        void duExcludeFrom() {
            assertEquals(new ArgumentRule.PrefixBlock("--exclude-"), rejected("du", "--exclude-f=list", "/var").rule());
            assertEquals(new ArgumentRule.PrefixBlock("--exclude-"), rejected("du", "--exclude-", "list").rule());
            assertTrue(authorize("du", "--exclude=*.gz", "-sh", "/var/log").isApproved());
        }

        @Test
        @DisplayName("ss: --diag, --filter and --kill in any abbreviated form")
        void ssLongOptions() {
            assertEquals(new ArgumentRule.PrefixBlock("--di"), rejected("ss", "--diag=/home/user/.bashrc").rule());
            assertEquals(new ArgumentRule.PrefixBlock("--di"), rejected("ss", "--di", "/tmp/out").rule());
            assertEquals(new ArgumentRule.PrefixBlock("--fi"), rejected("ss", "--filt=/etc/shadow").rule());
            assertEquals(new ArgumentRule.PrefixBlock("--ki"), rejected("ss", "--kill").rule());
            assertTrue(authorize("ss", "-tlnp").isApproved());
            assertTrue(authorize("ss", "--tcp", "--listening").isApproved());
        }

        @Test
        @DisplayName("ip: double-dash spellings of -batch and -force")
        void ipDoubleDash() {
            assertEquals(new ArgumentRule.PrefixBlock("--ba"), rejected("ip", "--batch", "/tmp/cmds").rule());
            assertEquals(new ArgumentRule.ExactBlock("--b"), rejected("ip", "--b", "/tmp/cmds").rule());
            assertEquals(new ArgumentRule.PrefixBlock("--fo"), rejected("ip", "--force", "-b", "x").rule());
            assertEquals(new ArgumentRule.PrefixBlock("-fo"), rejected("ip", "-forc", "link").rule());
        }

        @Test
        @DisplayName("ip: abbreviated objects and subcommands")
        void ipAbbreviatedSubcommands() {
            assertEquals(ArgumentRule.SubcommandBlock.of("netns exec"), rejected("ip", "netns", "e", "x", "sh").rule());
            assertEquals(new ArgumentRule.PrefixBlock("netn"), rejected("ip", "netn", "list").rule());
            assertEquals(ArgumentRule.SubcommandBlock.of("link set"), rejected("ip", "l", "s", "eth0", "down").rule());
            assertEquals(ArgumentRule.SubcommandBlock.of("addr add"),
                    rejected("ip", "a", "a", "10.0.0.1/24", "dev", "eth0").rule());
        }

        @Test
        @DisplayName("hostname: abbreviations of --file")
        void hostnameFile() {
            assertEquals(new ArgumentRule.PrefixBlock("--fi"), rejected("hostname", "--fil=/etc/shadow").rule());
            assertTrue(authorize("hostname", "--fqdn").isApproved());
        }
    }

    @Test
    @DisplayName("arguments are read once and the approval carries exactly what was checked")
    void checksOneSnapshot() {
        var reads = new AtomicInteger();
        List<String> shifting = new AbstractList<>() {
            @Override
            public String get(int index) {
                return reads.getAndIncrement() == 0 ? "-sh" : "--files0-from=/etc/shadow";
            }

            @Override
            public int size() {
                return 1;
            }
        };

        Authorization result = authorizer.authorize("du", shifting);

        assertTrue(result.isApproved());
        assertEquals(List.of("-sh"), result.approval().args());
        assertEquals(1, reads.get());
    }

    @Test
    @DisplayName("approval keeps a copy of the arguments")
    void approvalCopiesArgs() {
        var args = new ArrayList<>(List.of("-h"));
        Authorization result = authorizer.authorize("df", args);
        args.add("/etc");
        assertEquals(List.of("-h"), result.approval().args());
    }

    @Test
    @DisplayName("decisions are counted")
    void metrics() {
        authorize("df");
        authorize("rm");
        assertEquals(1.0, registry.find("hostprobe.authorization.decisions")
                .tag("result", "approved").counter().count());
        assertEquals(1.0, registry.find("hostprobe.authorization.decisions")
                .tag("kind", "unauthorized_command").counter().count());
    }
}
