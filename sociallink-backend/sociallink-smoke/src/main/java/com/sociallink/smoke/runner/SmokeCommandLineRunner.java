package com.sociallink.smoke.runner;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs the smoke scenario once at startup; the process exit code reflects the result.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "sociallink.smoke", name = "run-on-startup", havingValue = "true", matchIfMissing = true)
public class SmokeCommandLineRunner implements CommandLineRunner, ExitCodeGenerator {

    private final SmokeTestRunner runner;
    private int exitCode;

    public SmokeCommandLineRunner(SmokeTestRunner runner) {
        this.runner = runner;
    }

    @Override
    public void run(String... args) {
        SmokeRunReport report = runner.run();
        exitCode = report.getExitCode();
        log.info("[RUN_FINISHED] status={} | completedSteps={} | failedStep={} | exitCode={}",
                report.getStatus(), report.getCompletedSteps().size(), report.getFailedStep(), exitCode);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
