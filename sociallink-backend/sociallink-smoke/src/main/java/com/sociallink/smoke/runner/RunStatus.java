package com.sociallink.smoke.runner;

public enum RunStatus {
    PASSED(0),
    ASSERTION_FAILED(1),
    UNREACHABLE(2),
    ERROR(3);

    private final int exitCode;

    RunStatus(int exitCode) {
        this.exitCode = exitCode;
    }

    public int getExitCode() {
        return exitCode;
    }
}
