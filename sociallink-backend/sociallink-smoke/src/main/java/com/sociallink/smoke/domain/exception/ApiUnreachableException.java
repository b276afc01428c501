package com.sociallink.smoke.domain.exception;

/**
 * Thrown when the API under test cannot be reached at all (refused connection,
 * unknown host, I/O failure). Reported separately from assertion failures.
 */
public class ApiUnreachableException extends RuntimeException {

    private final String target;

    public ApiUnreachableException(String target, Throwable cause) {
        super("Could not connect to " + target, cause);
        this.target = target;
    }

    public String getTarget() {
        return target;
    }
}
