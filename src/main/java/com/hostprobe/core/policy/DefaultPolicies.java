package com.hostprobe.core.policy;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Built-in whitelist of read-only diagnostic commands and their argument blocklists.
 */
final class DefaultPolicies {

    static final List<String> ALLOWED_ROOTS = List.of(
            "/var/log",
            "/var/adm",
            "/var/eventlog",
            "/usr/local/var/log"
    );

    static final List<String> SECRET_PATTERNS = List.of(
            "*SECRET*",
            "*PASSWORD*",
            "*PASSWD*",
            "*TOKEN*",
            "*KEY*",
            "*CREDENTIAL*",
            "*PRIVATE*",
            "AUTH",
            "*_AUTH",
            "AUTH_*",
            "CERT",
            "*_CERT"
    );

    static final String FORBIDDEN_CHARACTERS = ";&|`$()><{}!";

    private DefaultPolicies() {}

    static Map<String, PolicyProperties.CommandRule> commands() {
        Map<String, PolicyProperties.CommandRule> commands = new LinkedHashMap<>();

        commands.put("ping", new PolicyProperties.CommandRule()
                .exact("-f", "-i")
                .cluster("fi"));
        commands.put("traceroute", new PolicyProperties.CommandRule());
        commands.put("nslookup", new PolicyProperties.CommandRule());
        // -f reads queries from a file
        commands.put("dig", new PolicyProperties.CommandRule()
                .exact("-f")
                .cluster("f"));
        commands.put("netstat", new PolicyProperties.CommandRule());
        // -K closes sockets, -D/--diag writes a file, -F/--filter reads one.
        // Long options match any unambiguous abbreviation, so the shortest unique stems are blocked.
        commands.put("ss", new PolicyProperties.CommandRule()
                .exact("-D", "-F", "-K")
                .prefix("--di", "--fi", "--ki")
                .cluster("DFK"));
        // ip strips a leading "--" and resolves abbreviated options and objects
        commands.put("ip", new PolicyProperties.CommandRule()
                .exact("-b", "--b", "netns", "exec", "vrf")
                .prefix("-ba", "--ba", "-fo", "--fo", "netn")
                .subcommand(
                        "netns exec", "netns add", "netns delete",
                        "link set", "link add", "link delete",
                        "addr add", "addr del", "addr flush",
                        "address add", "address del",
                        "route add", "route del", "route replace", "route flush"));
        commands.put("ifconfig", new PolicyProperties.CommandRule()
                .exact("up", "down", "add", "del", "mtu", "netmask", "broadcast", "hw",
                        "promisc", "-promisc", "arp", "-arp", "metric", "txqueuelen", "pointopoint"));
        commands.put("df", new PolicyProperties.CommandRule());
        commands.put("du", new PolicyProperties.CommandRule()
                .exact("-X")
                .prefix("--f", "--exclude-")
                .cluster("X"));
        commands.put("free", new PolicyProperties.CommandRule());
        commands.put("uptime", new PolicyProperties.CommandRule());
        commands.put("uname", new PolicyProperties.CommandRule());
        commands.put("lsblk", new PolicyProperties.CommandRule());
        commands.put("lsof", new PolicyProperties.CommandRule());
        commands.put("whoami", new PolicyProperties.CommandRule());
        commands.put("hostname", new PolicyProperties.CommandRule()
                .exact("-F")
                .prefix("--fi")
                .cluster("F"));

        return commands;
    }
}
