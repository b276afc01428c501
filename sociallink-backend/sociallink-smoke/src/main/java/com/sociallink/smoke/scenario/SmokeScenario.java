package com.sociallink.smoke.scenario;

import com.sociallink.smoke.scenario.steps.AccountSteps;
import com.sociallink.smoke.scenario.steps.CommentSteps;
import com.sociallink.smoke.scenario.steps.ErrorCaseSteps;
import com.sociallink.smoke.scenario.steps.LikeSteps;
import com.sociallink.smoke.scenario.steps.PostSteps;
import com.sociallink.smoke.scenario.steps.ValidationSteps;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * The fixed order of a smoke run. Later steps depend on ids captured by earlier
 * ones, so the order is not configurable.
 */
@Slf4j
@Component
public class SmokeScenario {

    private final List<ScenarioStep> steps;

    public SmokeScenario(AccountSteps account,
                         PostSteps posts,
                         CommentSteps comments,
                         LikeSteps likes,
                         ErrorCaseSteps errors,
                         ValidationSteps validation) {
        this.steps = List.of(
                // Account lifecycle
                ScenarioStep.of("User Registration", account::register),
                ScenarioStep.of("User Login Before Email Verification", account::loginBeforeVerification),
                ScenarioStep.of("Email Verification Request", account::requestVerification),
                ScenarioStep.of("Email Verification Confirmation", account::confirmVerification),
                ScenarioStep.of("User Login After Email Verification", account::loginAfterVerification),
                ScenarioStep.of("User Profile", account::profile),

                // Posts
                ScenarioStep.of("Create Post", posts::createPost),
                ScenarioStep.of("Get All Posts", posts::listPosts),
                ScenarioStep.of("Get Single Post", posts::getPost),
                ScenarioStep.of("Update Post", posts::updatePost),

                // Comments
                ScenarioStep.of("Create Comment", comments::createComment),
                ScenarioStep.of("Get Comments", comments::listComments),

                // Likes
                ScenarioStep.of("Like Post", likes::likePost),
                ScenarioStep.of("Unlike Post", likes::unlikePost),

                // Rejections
                ScenarioStep.of("Error Cases", errors::errorCases),
                ScenarioStep.of("Unauthenticated Access", errors::unauthenticatedAccess),
                ScenarioStep.of("Input Validation", validation::validationErrors),

                ScenarioStep.of("Cleanup", SmokeScenario::cleanup)
        );
    }

    public List<ScenarioStep> getSteps() {
        return steps;
    }

    /**
     * The API offers no way to delete users or posts, so test data stays behind.
     */
    private static StepOutcome cleanup(ScenarioContext context) {
        log.info("[CLEANUP] No remote cleanup available, test data kept | runId={} | userId={} | postId={}",
                context.getRunId(), context.getUserId(), context.getPostId());
        return StepOutcome.PASSED;
    }
}
