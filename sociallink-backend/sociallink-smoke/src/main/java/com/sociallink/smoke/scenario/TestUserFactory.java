package com.sociallink.smoke.scenario;

import com.sociallink.schema.api.dto.UserCreateRequestDto;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Builds the users of a run. Names and emails carry the run's epoch second so
 * repeated runs against the same deployment do not collide.
 */
@Component
public class TestUserFactory {

    static final String DEFAULT_PASSWORD = "password123";

    private final Clock clock;

    public TestUserFactory(Clock clock) {
        this.clock = clock;
    }

    public ScenarioContext newContext() {
        long runId = clock.instant().getEpochSecond();
        return new ScenarioContext(
                new UserCreateRequestDto("testuser_" + runId, "test_" + runId + "@example.com", DEFAULT_PASSWORD),
                new UserCreateRequestDto("testuser2_" + runId, "test2_" + runId + "@example.com", DEFAULT_PASSWORD),
                runId);
    }
}
