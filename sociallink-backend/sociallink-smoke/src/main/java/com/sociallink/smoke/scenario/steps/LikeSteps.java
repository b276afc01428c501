package com.sociallink.smoke.scenario.steps;

import com.sociallink.schema.api.dto.LikeResponseDto;
import com.sociallink.schema.domain.validation.PayloadValidator;
import com.sociallink.smoke.client.ApiResponse;
import com.sociallink.smoke.client.SocialApiClient;
import com.sociallink.smoke.scenario.ScenarioContext;
import com.sociallink.smoke.scenario.StepOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import static com.sociallink.smoke.scenario.Expectations.*;

/**
 * Like and unlike. The API has no endpoint exposing like state. A like is unique per
 * user and post, so a second like is refused while the first is stored and accepted
 * again once it is gone.
 */
@Slf4j
@Component
public class LikeSteps {

    private final SocialApiClient client;
    private final PayloadValidator validator;

    public LikeSteps(SocialApiClient client, PayloadValidator validator) {
        this.client = client;
        this.validator = validator;
    }

    public StepOutcome likePost(ScenarioContext context) {
        like(context);
        log.info("[POST_LIKED] Post liked | postId={} | userId={}", context.getPostId(), context.getUserId());

        ApiResponse duplicate = client.like(context.requireAuthToken(), context.requirePostId());
        expectThat(!duplicate.is2xxSuccessful(),
                "Liking the same post twice should be rejected (status " + duplicate.getStatus() + ")");
        log.info("[DUPLICATE_LIKE_REJECTED] Second like refused | postId={} | status={}",
                context.getPostId(), duplicate.getStatus());
        return StepOutcome.PASSED;
    }

    public StepOutcome unlikePost(ScenarioContext context) {
        unlike(context);
        log.info("[POST_UNLIKED] Post unliked | postId={}", context.getPostId());

        // Accepted again only if the unlike removed the stored like
        like(context);
        unlike(context);
        log.info("[LIKE_REMOVED] Like was removed, re-like and unlike succeeded | postId={}", context.getPostId());
        return StepOutcome.PASSED;
    }

    private void like(ScenarioContext context) {
        String postId = context.requirePostId();
        ApiResponse response = client.like(context.requireAuthToken(), postId);
        expectStatus(response, 201, "Like post failed");

        LikeResponseDto like = expectBody(response, LikeResponseDto.class, validator);
        expectEquals(postId, like.getPostId(), "Wrong post ID in like");
        expectEquals(context.requireUserId(), like.getUserId(), "Wrong user ID in like");
    }

    private void unlike(ScenarioContext context) {
        ApiResponse response = client.unlike(context.requireAuthToken(), context.requirePostId());
        expectStatus(response, 204, "Unlike post failed");
    }
}
