package com.sociallink.smoke.scenario;

import java.util.function.Function;

/**
 * One ordered step of a smoke run. Steps read what earlier steps captured from
 * the {@link ScenarioContext} and add what later steps need.
 */
public interface ScenarioStep {

    String name();

    /**
     * @throws com.sociallink.smoke.domain.exception.SmokeAssertionException if the API answers unexpectedly
     */
    StepOutcome execute(ScenarioContext context);

    static ScenarioStep of(String name, Function<ScenarioContext, StepOutcome> action) {
        return new ScenarioStep() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public StepOutcome execute(ScenarioContext context) {
                return action.apply(context);
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }
}
