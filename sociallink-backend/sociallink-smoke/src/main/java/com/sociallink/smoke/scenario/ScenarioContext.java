package com.sociallink.smoke.scenario;

import com.sociallink.schema.api.dto.UserCreateRequestDto;
import com.sociallink.schema.domain.model.VerificationState;
import com.sociallink.smoke.domain.exception.SmokeAssertionException;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * State threaded through one smoke run: the generated users and every id or
 * token captured by an earlier step. One instance per run.
 */
@Getter
@Setter
public class ScenarioContext {

    private final UserCreateRequestDto primaryUser;
    private final UserCreateRequestDto secondaryUser;
    private final long runId;

    private String authToken;
    private String userId;
    private String postId;
    private String commentId;
    private VerificationState verificationState;

    private final List<String> warnings = new ArrayList<>();

    public ScenarioContext(UserCreateRequestDto primaryUser, UserCreateRequestDto secondaryUser, long runId) {
        this.primaryUser = primaryUser;
        this.secondaryUser = secondaryUser;
        this.runId = runId;
    }

    public String requireAuthToken() {
        return require(authToken, "No auth token available");
    }

    public String requireUserId() {
        return require(userId, "No user ID available");
    }

    public String requirePostId() {
        return require(postId, "No post ID available");
    }

    public String requireCommentId() {
        return require(commentId, "No comment ID available");
    }

    public void addWarning(String warning) {
        warnings.add(warning);
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    private static String require(String value, String message) {
        if (value == null) {
            throw new SmokeAssertionException(message);
        }
        return value;
    }
}
