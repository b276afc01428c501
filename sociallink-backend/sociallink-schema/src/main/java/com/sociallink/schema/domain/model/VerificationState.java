package com.sociallink.schema.domain.model;

/**
 * Email verification lifecycle of an account.
 *
 * REGISTERED_UNVERIFIED -> VERIFICATION_REQUESTED -> VERIFIED
 *
 * Only a VERIFIED account may log in. A verification token can only be
 * confirmed after one was requested.
 */
public enum VerificationState {
    REGISTERED_UNVERIFIED,
    VERIFICATION_REQUESTED,
    VERIFIED;

    /**
     * A new verification email was asked for. Asking again keeps the state.
     *
     * @throws IllegalStateException if the account is already verified
     */
    public VerificationState onVerificationRequested() {
        if (this == VERIFIED) {
            throw new IllegalStateException("Email already verified");
        }
        return VERIFICATION_REQUESTED;
    }

    /**
     * A valid verification token was confirmed.
     *
     * @throws IllegalStateException unless verification was requested first
     */
    public VerificationState onConfirmed() {
        if (this != VERIFICATION_REQUESTED) {
            throw new IllegalStateException("Cannot confirm verification from state " + name());
        }
        return VERIFIED;
    }

    public boolean canLogin() {
        return this == VERIFIED;
    }
}
