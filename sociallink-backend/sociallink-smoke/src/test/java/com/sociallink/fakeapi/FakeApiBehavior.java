package com.sociallink.fakeapi;

import lombok.Data;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

/**
 * Switches for making the fake API misbehave in a test. Reset before each test.
 */
@Data
@Component
public class FakeApiBehavior {

    private HttpStatus schemaViolationStatus = HttpStatus.UNPROCESSABLE_ENTITY;
    private boolean keepLikesOnUnlike = false;
    // Likes answered as created and removed without being stored
    private boolean statelessLikes = false;

    public void reset() {
        schemaViolationStatus = HttpStatus.UNPROCESSABLE_ENTITY;
        keepLikesOnUnlike = false;
        statelessLikes = false;
    }
}
