package com.hostprobe.core.exec;

/**
 * Maps the {@code 128 + n} exit status of a signalled child back to a signal name.
 */
final class Signals {

    private static final String[] NAMES = {
            null, "SIGHUP", "SIGINT", "SIGQUIT", "SIGILL", "SIGTRAP", "SIGABRT", "SIGBUS", "SIGFPE",
            "SIGKILL", "SIGUSR1", "SIGSEGV", "SIGUSR2", "SIGPIPE", "SIGALRM", "SIGTERM", "SIGSTKFLT",
            "SIGCHLD", "SIGCONT", "SIGSTOP", "SIGTSTP", "SIGTTIN", "SIGTTOU", "SIGURG", "SIGXCPU",
            "SIGXFSZ", "SIGVTALRM", "SIGPROF", "SIGWINCH", "SIGIO", "SIGPWR", "SIGSYS"
    };

    private Signals() {}

    /**
     * @return the signal name for exit statuses 129..159, otherwise {@code null}
     */
    static String fromExitStatus(int exitStatus) {
        int n = exitStatus - 128;
        if (n < 1 || n >= NAMES.length) {
            return null;
        }
        return NAMES[n];
    }
}
