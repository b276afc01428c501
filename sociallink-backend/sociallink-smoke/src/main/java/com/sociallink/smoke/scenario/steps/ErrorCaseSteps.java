package com.sociallink.smoke.scenario.steps;

import com.sociallink.schema.api.dto.CommentRequestDto;
import com.sociallink.schema.api.dto.PostRequestDto;
import com.sociallink.schema.api.dto.UserCreateRequestDto;
import com.sociallink.schema.api.dto.UserLoginRequestDto;
import com.sociallink.smoke.client.ApiResponse;
import com.sociallink.smoke.client.SocialApiClient;
import com.sociallink.smoke.scenario.ScenarioContext;
import com.sociallink.smoke.scenario.StepOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

import static com.sociallink.smoke.scenario.Expectations.*;

/**
 * Rejections the API must produce: bad credentials, duplicate email, bad or
 * missing bearer tokens and unknown ids.
 */
@Slf4j
@Component
public class ErrorCaseSteps {

    static final String GARBAGE_TOKEN = "invalid_token";
    static final String UNKNOWN_POST_ID = "non-existent-id";

    private final SocialApiClient client;

    public ErrorCaseSteps(SocialApiClient client) {
        this.client = client;
    }

    public StepOutcome errorCases(ScenarioContext context) {
        ApiResponse invalidLogin = client.login(new UserLoginRequestDto("wrong@email.com", "wrongpass"));
        expectStatus(invalidLogin, 401, "Invalid login should be rejected");
        log.info("[CHECK_OK] Invalid login correctly rejected");

        // Same email under another username still counts as a duplicate
        UserCreateRequestDto primary = context.getPrimaryUser();
        UserCreateRequestDto duplicate = new UserCreateRequestDto(
                context.getSecondaryUser().getUsername(), primary.getEmail(), primary.getPassword());
        expectStatus(client.register(duplicate), 400, "Duplicate registration should be rejected");
        log.info("[CHECK_OK] Duplicate registration correctly rejected | email={}", primary.getEmail());

        expectStatus(client.profile(GARBAGE_TOKEN), 401, "Invalid token should be rejected");
        log.info("[CHECK_OK] Invalid token correctly rejected");

        expectStatus(client.getPost(UNKNOWN_POST_ID), 404, "Non-existent post should return 404");
        log.info("[CHECK_OK] Non-existent post correctly handled");

        return StepOutcome.PASSED;
    }

    /**
     * Every auth-required endpoint answers 401 both without a token and with a garbage one.
     */
    public StepOutcome unauthenticatedAccess(ScenarioContext context) {
        String postId = context.requirePostId();

        Map<String, Function<String, ApiResponse>> protectedCalls = new LinkedHashMap<>();
        protectedCalls.put("profile", client::profile);
        protectedCalls.put("create post", token -> client.createPost(token, new PostRequestDto("unauthorized")));
        protectedCalls.put("update post", token -> client.updatePost(token, postId, new PostRequestDto("unauthorized")));
        protectedCalls.put("create comment",
                token -> client.createComment(token, postId, new CommentRequestDto("unauthorized")));
        protectedCalls.put("like", token -> client.like(token, postId));
        protectedCalls.put("unlike", token -> client.unlike(token, postId));

        for (Map.Entry<String, Function<String, ApiResponse>> call : protectedCalls.entrySet()) {
            expectStatus(call.getValue().apply(null), 401, call.getKey() + " without a token should be rejected");
            expectStatus(call.getValue().apply(GARBAGE_TOKEN), 401,
                    call.getKey() + " with an invalid token should be rejected");
        }

        log.info("[CHECK_OK] Auth-required endpoints reject missing and invalid tokens | endpoints={}",
                protectedCalls.keySet());
        return StepOutcome.PASSED;
    }
}
