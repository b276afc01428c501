package com.sociallink.smoke.verification;

import com.sociallink.smoke.config.SmokeProperties;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Token from {@code sociallink.smoke.verification-token}, issued to
 * {@code sociallink.smoke.verification-token-email} when that is set.
 *
 * The run's user is created fresh each time, so a configured token normally
 * belongs to a seeded account and only its single-use behavior can be checked.
 */
@Component
public class ConfiguredVerificationTokenSource implements VerificationTokenSource {

    private final SmokeProperties properties;

    public ConfiguredVerificationTokenSource(SmokeProperties properties) {
        this.properties = properties;
    }

    @Override
    public Optional<VerificationToken> tokenFor(String email) {
        String token = trimToNull(properties.getVerificationToken());
        if (token == null) {
            return Optional.empty();
        }
        return Optional.of(new VerificationToken(token, trimToNull(properties.getVerificationTokenEmail())));
    }

    private static String trimToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
