package com.sociallink.smoke.scenario.steps;

import com.sociallink.schema.api.dto.PostRequestDto;
import com.sociallink.schema.api.dto.PostResponseDto;
import com.sociallink.schema.domain.validation.PayloadValidator;
import com.sociallink.smoke.client.ApiResponse;
import com.sociallink.smoke.client.SocialApiClient;
import com.sociallink.smoke.scenario.ScenarioContext;
import com.sociallink.smoke.scenario.StepOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import static com.sociallink.smoke.scenario.Expectations.*;

@Slf4j
@Component
public class PostSteps {

    static final String POST_TEXT = "This is a test post created by the automated test suite!";
    static final String UPDATED_POST_TEXT = "This post has been updated by the test suite!";

    private final SocialApiClient client;
    private final PayloadValidator validator;

    public PostSteps(SocialApiClient client, PayloadValidator validator) {
        this.client = client;
        this.validator = validator;
    }

    public StepOutcome createPost(ScenarioContext context) {
        ApiResponse response = client.createPost(context.requireAuthToken(), new PostRequestDto(POST_TEXT));
        expectStatus(response, 201, "Post creation failed");

        PostResponseDto post = expectBody(response, PostResponseDto.class, validator);
        expectEquals(POST_TEXT, post.getText(), "Post text doesn't match");

        context.setPostId(post.getId());
        log.info("[POST_CREATED] Post created | postId={} | createdAt={}", post.getId(), post.getCreatedAt());
        return StepOutcome.PASSED;
    }

    public StepOutcome listPosts(ScenarioContext context) {
        ApiResponse response = client.listPosts();
        expectStatus(response, 200, "Get posts failed");
        expectJsonArray(response, "Response should be a list");

        log.info("[POSTS_LISTED] Found {} posts", response.json().size());
        return StepOutcome.PASSED;
    }

    public StepOutcome getPost(ScenarioContext context) {
        String postId = context.requirePostId();
        PostResponseDto post = fetchPost(postId);
        expectEquals(POST_TEXT, post.getText(), "Fetched post text doesn't match");

        log.info("[POST_FETCHED] Post fetched | postId={}", postId);
        return StepOutcome.PASSED;
    }

    /**
     * Updates the post and reads it back, so the new text has to be persisted, not only echoed.
     */
    public StepOutcome updatePost(ScenarioContext context) {
        String postId = context.requirePostId();
        ApiResponse response = client.updatePost(context.requireAuthToken(), postId,
                new PostRequestDto(UPDATED_POST_TEXT));
        expectStatus(response, 200, "Update post failed");

        PostResponseDto updated = expectBody(response, PostResponseDto.class, validator);
        expectEquals(UPDATED_POST_TEXT, updated.getText(), "Post text not updated");
        expectEquals(postId, updated.getId(), "Wrong post ID");

        PostResponseDto reread = fetchPost(postId);
        expectEquals(UPDATED_POST_TEXT, reread.getText(), "Updated text not returned on re-fetch");

        log.info("[POST_UPDATED] Post updated | postId={}", postId);
        return StepOutcome.PASSED;
    }

    private PostResponseDto fetchPost(String postId) {
        ApiResponse response = client.getPost(postId);
        expectStatus(response, 200, "Get single post failed");

        PostResponseDto post = expectBody(response, PostResponseDto.class, validator);
        expectEquals(postId, post.getId(), "Wrong post ID");
        return post;
    }
}
