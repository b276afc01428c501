package com.sociallink.smoke.verification;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * A verification token obtained outside the API, with the address it was issued to
 * when that is known.
 */
@Getter
@AllArgsConstructor
public class VerificationToken {

    private final String value;

    /**
     * Null when the token's account is not known.
     */
    private final String email;

    public boolean isIssuedTo(String address) {
        return email != null && email.equalsIgnoreCase(address);
    }
}
