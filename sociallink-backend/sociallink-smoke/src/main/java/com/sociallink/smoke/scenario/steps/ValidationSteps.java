package com.sociallink.smoke.scenario.steps;

import com.sociallink.schema.api.dto.UserCreateRequestDto;
import com.sociallink.smoke.client.SocialApiClient;
import com.sociallink.smoke.scenario.ScenarioContext;
import com.sociallink.smoke.scenario.StepOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import static com.sociallink.smoke.scenario.Expectations.expectStatus;

/**
 * Input validation on registration. A malformed email is a 422 and a short password
 * a 400; the two codes are part of the API contract and checked separately.
 */
@Slf4j
@Component
public class ValidationSteps {

    static final String SHORT_PASSWORD = "123";

    private final SocialApiClient client;

    public ValidationSteps(SocialApiClient client) {
        this.client = client;
    }

    public StepOutcome validationErrors(ScenarioContext context) {
        String username = "testuser3_" + context.getRunId();

        expectStatus(client.register(new UserCreateRequestDto(username, "invalid-email", "password123")),
                422, "Invalid email should be rejected");
        log.info("[CHECK_OK] Invalid email format correctly rejected");

        String email = "test3_" + context.getRunId() + "@example.com";
        expectStatus(client.register(new UserCreateRequestDto(username, email, SHORT_PASSWORD)),
                400, "Short password should be rejected");
        log.info("[CHECK_OK] Short password correctly rejected");

        return StepOutcome.PASSED;
    }
}
