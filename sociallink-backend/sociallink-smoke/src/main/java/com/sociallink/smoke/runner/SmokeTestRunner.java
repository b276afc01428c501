package com.sociallink.smoke.runner;

import com.sociallink.smoke.client.SocialApiClient;
import com.sociallink.smoke.domain.exception.ApiUnreachableException;
import com.sociallink.smoke.domain.exception.SmokeAssertionException;
import com.sociallink.smoke.scenario.ScenarioContext;
import com.sociallink.smoke.scenario.ScenarioStep;
import com.sociallink.smoke.scenario.SmokeScenario;
import com.sociallink.smoke.scenario.StepOutcome;
import com.sociallink.smoke.scenario.TestUserFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Smoke Test Runner - executes the scenario steps in order against one deployment
 *
 * Failure handling:
 * - assertion failure: run aborted, remaining steps skipped
 * - API unreachable: run aborted, reported apart from assertion failures
 * - anything else: run aborted, logged with stack trace
 */
@Slf4j
@Service
public class SmokeTestRunner {

    private static final String RULE = "=".repeat(60);

    private final List<ScenarioStep> steps;
    private final TestUserFactory userFactory;
    private final String target;

    @Autowired
    public SmokeTestRunner(SmokeScenario scenario, TestUserFactory userFactory, SocialApiClient client) {
        this(scenario.getSteps(), userFactory, client.getApiBaseUrl());
    }

    public SmokeTestRunner(List<ScenarioStep> steps, TestUserFactory userFactory, String target) {
        this.steps = List.copyOf(steps);
        this.userFactory = userFactory;
        this.target = target;
    }

    public SmokeRunReport run() {
        return run(userFactory.newContext());
    }

    public SmokeRunReport run(ScenarioContext context) {
        log.info("[RUN_START] Starting backend API smoke run | target={} | runId={} | steps={}",
                target, context.getRunId(), steps.size());
        log.info(RULE);

        List<String> completed = new ArrayList<>();
        String current = null;
        try {
            for (ScenarioStep step : steps) {
                current = step.name();
                log.info(RULE);
                log.info("[STEP_START] {}", current);
                log.info(RULE);

                StepOutcome outcome = step.execute(context);
                completed.add(current);
                if (outcome == StepOutcome.WARNED) {
                    log.warn("[STEP_WARNED] {} | completed with warnings", current);
                } else {
                    log.info("[STEP_PASSED] {}", current);
                }
            }
        } catch (SmokeAssertionException e) {
            log.error("[ASSERTION_FAILED] Test assertion failed | step={} | error={}", current, e.getMessage(), e);
            return SmokeRunReport.failed(RunStatus.ASSERTION_FAILED, completed, context.getWarnings(),
                    current, e.getMessage());
        } catch (ApiUnreachableException e) {
            log.error("[API_UNREACHABLE] Could not connect to {} | step={} | error={}",
                    e.getTarget(), current, e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            log.error("[API_UNREACHABLE] Make sure the backend server is running and reachable at {}", e.getTarget());
            return SmokeRunReport.failed(RunStatus.UNREACHABLE, completed, context.getWarnings(),
                    current, e.getMessage());
        } catch (RuntimeException e) {
            log.error("[RUN_ERROR] Test error | step={} | error={}", current, e.getMessage(), e);
            return SmokeRunReport.failed(RunStatus.ERROR, completed, context.getWarnings(),
                    current, String.valueOf(e.getMessage()));
        }

        log.info(RULE);
        log.info("[RUN_PASSED] All smoke steps completed successfully | steps={} | warnings={}",
                completed.size(), context.getWarnings().size());
        for (String warning : context.getWarnings()) {
            log.warn("[RUN_WARNING] {}", warning);
        }
        log.info(RULE);
        return SmokeRunReport.passed(completed, context.getWarnings());
    }
}
