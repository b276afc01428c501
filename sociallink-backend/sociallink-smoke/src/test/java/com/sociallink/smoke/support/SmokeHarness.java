package com.sociallink.smoke.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sociallink.schema.domain.validation.PayloadValidator;
import com.sociallink.smoke.client.SocialApiClient;
import com.sociallink.smoke.config.RestTemplateConfig;
import com.sociallink.smoke.config.SmokeProperties;
import com.sociallink.smoke.runner.SmokeTestRunner;
import com.sociallink.smoke.scenario.SmokeScenario;
import com.sociallink.smoke.scenario.TestUserFactory;
import com.sociallink.smoke.scenario.steps.AccountSteps;
import com.sociallink.smoke.scenario.steps.CommentSteps;
import com.sociallink.smoke.scenario.steps.ErrorCaseSteps;
import com.sociallink.smoke.scenario.steps.LikeSteps;
import com.sociallink.smoke.scenario.steps.PostSteps;
import com.sociallink.smoke.scenario.steps.ValidationSteps;
import com.sociallink.smoke.verification.VerificationTokenSource;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Wires a smoke run by hand, the way the Spring context does, for tests that
 * point it at a fake or unreachable API.
 */
public final class SmokeHarness {

    // Distinct run ids keep generated emails unique across tests sharing one fake API
    private static final AtomicLong RUN_IDS = new AtomicLong(1_700_000_000L);

    private final RestTemplate restTemplate;
    private final SocialApiClient client;

    private SmokeHarness(SmokeProperties properties) {
        this.restTemplate = new RestTemplateConfig().smokeRestTemplate(properties);
        this.client = new SocialApiClient(restTemplate, new ObjectMapper(), properties);
    }

    public static SmokeHarness forBaseUrl(String baseUrl) {
        SmokeProperties properties = new SmokeProperties();
        properties.setBaseUrl(baseUrl);
        return forProperties(properties);
    }

    public static SmokeHarness forProperties(SmokeProperties properties) {
        return new SmokeHarness(properties);
    }

    public static Clock uniqueRunClock() {
        return Clock.fixed(Instant.ofEpochSecond(RUN_IDS.incrementAndGet()), ZoneOffset.UTC);
    }

    public static VerificationTokenSource noVerificationToken() {
        return email -> Optional.empty();
    }

    public RestTemplate getRestTemplate() {
        return restTemplate;
    }

    public SocialApiClient getClient() {
        return client;
    }

    public SmokeScenario scenario(VerificationTokenSource tokenSource) {
        PayloadValidator validator = PayloadValidator.createDefault();
        return new SmokeScenario(
                new AccountSteps(client, validator, tokenSource),
                new PostSteps(client, validator),
                new CommentSteps(client, validator),
                new LikeSteps(client, validator),
                new ErrorCaseSteps(client),
                new ValidationSteps(client));
    }

    public SmokeTestRunner runner(VerificationTokenSource tokenSource) {
        return new SmokeTestRunner(scenario(tokenSource), new TestUserFactory(uniqueRunClock()), client);
    }
}
