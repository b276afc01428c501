package com.sociallink.smoke.scenario.steps;

import com.sociallink.schema.api.dto.EmailVerificationRequestDto;
import com.sociallink.schema.api.dto.MessageResponseDto;
import com.sociallink.schema.api.dto.ProfileResponseDto;
import com.sociallink.schema.api.dto.TokenResponseDto;
import com.sociallink.schema.api.dto.UserCreateRequestDto;
import com.sociallink.schema.domain.model.VerificationState;
import com.sociallink.schema.domain.validation.PayloadValidator;
import com.sociallink.smoke.client.ApiResponse;
import com.sociallink.smoke.client.SocialApiClient;
import com.sociallink.smoke.scenario.ScenarioContext;
import com.sociallink.smoke.scenario.StepOutcome;
import com.sociallink.smoke.verification.VerificationToken;
import com.sociallink.smoke.verification.VerificationTokenSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

import static com.sociallink.smoke.scenario.Expectations.*;

/**
 * Account lifecycle: registration, email verification, login and profile.
 *
 * Registration hands out a token right away while login is refused until the
 * email is verified. Both behaviors are checked as observed.
 */
@Slf4j
@Component
public class AccountSteps {

    static final String DUMMY_VERIFICATION_TOKEN = "dummy_token_for_testing";

    private final SocialApiClient client;
    private final PayloadValidator validator;
    private final VerificationTokenSource tokenSource;

    public AccountSteps(SocialApiClient client, PayloadValidator validator, VerificationTokenSource tokenSource) {
        this.client = client;
        this.validator = validator;
        this.tokenSource = tokenSource;
    }

    public StepOutcome register(ScenarioContext context) {
        UserCreateRequestDto user = context.getPrimaryUser();
        ApiResponse response = client.register(user);
        expectStatus(response, 201, "Registration failed");

        TokenResponseDto session = expectBody(response, TokenResponseDto.class, validator);
        String userId = session.getUser().getId();
        expectThat(!userId.equals(user.getEmail()) && !userId.equals(user.getUsername()),
                "User id must be an opaque id, got " + userId);
        expectEquals(user.getEmail(), session.getUser().getEmail(), "Registered email not echoed");

        context.setAuthToken(session.getToken());
        context.setUserId(userId);
        context.setVerificationState(VerificationState.REGISTERED_UNVERIFIED);

        log.info("[REGISTERED] Test user registered | userId={} | email={}", userId, user.getEmail());
        return StepOutcome.PASSED;
    }

    public StepOutcome loginBeforeVerification(ScenarioContext context) {
        // The full registration body is posted on purpose; login only reads email and password
        ApiResponse response = client.login(context.getPrimaryUser());
        expectStatus(response, 401, "Login should fail before verification");
        expectDetailContains(response, "Please verify your email", "Wrong error message");

        log.info("[LOGIN_BLOCKED] Login correctly blocked, email not verified | detail={}", response.detail());
        return StepOutcome.PASSED;
    }

    public StepOutcome requestVerification(ScenarioContext context) {
        ApiResponse response = client.requestVerification(
                new EmailVerificationRequestDto(context.getPrimaryUser().getEmail()));
        expectStatus(response, 200, "Email verification request failed");
        expectThat(response.json().has("message"), "No message in response");
        expectBody(response, MessageResponseDto.class, validator);

        context.setVerificationState(context.getVerificationState().onVerificationRequested());
        log.info("[VERIFICATION_REQUESTED] Verification email requested | email={}",
                context.getPrimaryUser().getEmail());
        return StepOutcome.PASSED;
    }

    /**
     * An unknown token is always rejected. When a real token is at hand it must be
     * accepted once and rejected on replay. The test user only counts as verified
     * when the token was issued to its address.
     */
    public StepOutcome confirmVerification(ScenarioContext context) {
        ApiResponse rejected = client.confirmVerification(DUMMY_VERIFICATION_TOKEN);
        expectStatus(rejected, 400, "Invalid token should be rejected");
        expectDetailContains(rejected, "Invalid or expired", "Wrong error message for invalid token");
        log.info("[TOKEN_REJECTED] Dummy verification token correctly rejected");

        String email = context.getPrimaryUser().getEmail();
        Optional<VerificationToken> realToken = tokenSource.tokenFor(email);
        if (realToken.isEmpty()) {
            log.info("[TOKEN_UNAVAILABLE] No real verification token configured, skipping confirmation");
            return StepOutcome.PASSED;
        }
        VerificationToken token = realToken.get();

        ApiResponse confirmed = client.confirmVerification(token.getValue());
        expectStatus(confirmed, 200, "Valid verification token was not accepted");
        if (token.isIssuedTo(email)) {
            context.setVerificationState(context.getVerificationState().onConfirmed());
            log.info("[EMAIL_VERIFIED] Verification token accepted | email={}", email);
        } else {
            log.info("[TOKEN_ACCEPTED_OTHER_ACCOUNT] Token accepted for another account, test user stays unverified "
                    + "| tokenEmail={} | email={}", token.getEmail(), email);
        }

        ApiResponse replayed = client.confirmVerification(token.getValue());
        expectStatus(replayed, 400, "Verification token must be single use");
        expectDetailContains(replayed, "Invalid or expired", "Wrong error message for a used token");
        log.info("[TOKEN_REPLAY_REJECTED] Used verification token correctly rejected");
        return StepOutcome.PASSED;
    }

    /**
     * Without a verified email a refusal is expected and only warned about; once the
     * run has verified the account, login has to succeed.
     */
    public StepOutcome loginAfterVerification(ScenarioContext context) {
        ApiResponse response = client.login(context.getPrimaryUser());

        if (response.getStatus() == 200) {
            TokenResponseDto session = expectBody(response, TokenResponseDto.class, validator);
            context.setAuthToken(session.getToken());
            context.setUserId(session.getUser().getId());
            log.info("[LOGIN_SUCCESS] Logged in | userId={}", session.getUser().getId());
            return StepOutcome.PASSED;
        }

        expectThat(!context.getVerificationState().canLogin(),
                "Login failed after the email was verified (status " + response.getStatus() + "): "
                        + response.getBody());

        String warning = "Login failed - email not verified yet (status " + response.getStatus()
                + "), continuing with the registration token";
        context.addWarning(warning);
        log.warn("[LOGIN_PENDING_VERIFICATION] {}", warning);
        return StepOutcome.WARNED;
    }

    public StepOutcome profile(ScenarioContext context) {
        ApiResponse response = client.profile(context.requireAuthToken());
        expectStatus(response, 200, "Profile retrieval failed");
        expectThat(response.json().has("user"), "No user data in response");

        ProfileResponseDto profile = expectBody(response, ProfileResponseDto.class, validator);
        expectEquals(context.getPrimaryUser().getEmail(), profile.getUser().getEmail(), "Wrong user email");

        log.info("[PROFILE_OK] Profile retrieved | userId={}", profile.getUser().getId());
        return StepOutcome.PASSED;
    }
}
