package com.sociallink.smoke.scenario.steps;

import com.fasterxml.jackson.databind.JsonNode;
import com.sociallink.schema.api.dto.CommentRequestDto;
import com.sociallink.schema.api.dto.CommentResponseDto;
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
public class CommentSteps {

    static final String COMMENT_TEXT = "This is a test comment!";

    private final SocialApiClient client;
    private final PayloadValidator validator;

    public CommentSteps(SocialApiClient client, PayloadValidator validator) {
        this.client = client;
        this.validator = validator;
    }

    public StepOutcome createComment(ScenarioContext context) {
        String postId = context.requirePostId();
        ApiResponse response = client.createComment(context.requireAuthToken(), postId,
                new CommentRequestDto(COMMENT_TEXT));
        expectStatus(response, 201, "Comment creation failed");

        CommentResponseDto comment = expectBody(response, CommentResponseDto.class, validator);
        expectEquals(COMMENT_TEXT, comment.getText(), "Comment text doesn't match");
        expectEquals(postId, comment.getPostId(), "Wrong post ID in comment");

        context.setCommentId(comment.getId());
        log.info("[COMMENT_CREATED] Comment created | commentId={} | postId={}", comment.getId(), postId);
        return StepOutcome.PASSED;
    }

    public StepOutcome listComments(ScenarioContext context) {
        String postId = context.requirePostId();
        String commentId = context.requireCommentId();
        ApiResponse response = client.listComments(postId);
        expectStatus(response, 200, "Get comments failed");
        expectJsonArray(response, "Response should be a list");

        boolean found = false;
        for (JsonNode comment : response.json()) {
            if (commentId.equals(comment.path("id").asText(null))) {
                found = true;
                break;
            }
        }
        expectThat(found, "Created comment " + commentId + " missing from the post's comments");

        log.info("[COMMENTS_LISTED] Found {} comments | postId={}", response.json().size(), postId);
        return StepOutcome.PASSED;
    }
}
