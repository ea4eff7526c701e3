package com.air.worktree;

import java.util.List;

/**
 * Outcome of one external command.
 *
 * @param command  the command as run, credentials masked
 * @param exitCode process exit code, -1 when it timed out
 * @param stdout   captured standard output
 * @param stderr   captured standard error
 * @param timedOut whether the process was killed for exceeding its timeout
 */
public record CommandResult(List<String> command, int exitCode, String stdout, String stderr, boolean timedOut) {

    public boolean succeeded() {
        return !timedOut && exitCode == 0;
    }

    /** One-line description of a failure, suitable for a review's message file. */
    public String diagnostic() {
        String what = String.join(" ", command);
        if (timedOut) {
            return what + " timed out";
        }
        String err = stderr == null ? "" : stderr.strip();
        return what + " failed (exit " + exitCode + ")" + (err.isEmpty() ? "" : ": " + err);
    }
}
