package com.sociallink.smoke.runner;

import lombok.Getter;

import java.util.List;

/**
 * Outcome of one smoke run.
 */
@Getter
public class SmokeRunReport {

    private final RunStatus status;
    private final List<String> completedSteps;
    private final List<String> warnings;
    private final String failedStep;       // null when passed
    private final String failureMessage;   // null when passed

    private SmokeRunReport(RunStatus status, List<String> completedSteps, List<String> warnings,
                           String failedStep, String failureMessage) {
        this.status = status;
        this.completedSteps = List.copyOf(completedSteps);
        this.warnings = List.copyOf(warnings);
        this.failedStep = failedStep;
        this.failureMessage = failureMessage;
    }

    public static SmokeRunReport passed(List<String> completedSteps, List<String> warnings) {
        return new SmokeRunReport(RunStatus.PASSED, completedSteps, warnings, null, null);
    }

    public static SmokeRunReport failed(RunStatus status, List<String> completedSteps, List<String> warnings,
                                        String failedStep, String failureMessage) {
        if (status == RunStatus.PASSED) {
            throw new IllegalArgumentException("A failed report needs a failure status");
        }
        return new SmokeRunReport(status, completedSteps, warnings, failedStep, failureMessage);
    }

    public boolean isPassed() {
        return status == RunStatus.PASSED;
    }

    public int getExitCode() {
        return status.getExitCode();
    }
}
