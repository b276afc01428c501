package com.sociallink.smoke.verification;

import java.util.Optional;

/**
 * Supplies a real email verification token, when one can be obtained outside the
 * API (mailbox, database, operator input).
 */
@FunctionalInterface
public interface VerificationTokenSource {

    /**
     * @param email address of the account the run wants to verify
     * @return a token, possibly issued to another account (see {@link VerificationToken#isIssuedTo})
     */
    Optional<VerificationToken> tokenFor(String email);
}
