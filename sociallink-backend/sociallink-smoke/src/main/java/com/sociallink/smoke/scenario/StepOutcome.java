package com.sociallink.smoke.scenario;

public enum StepOutcome {
    PASSED,
    /** Unexpected but tolerated; recorded as a warning and the run continues. */
    WARNED
}
