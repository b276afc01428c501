package com.sociallink.smoke.config;

import com.sociallink.schema.domain.constants.ApiPaths;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings of a smoke run, bound from {@code sociallink.smoke.*}.
 */
@Data
@ConfigurationProperties(prefix = "sociallink.smoke")
public class SmokeProperties {

    /**
     * Scheme, host and port of the deployment under test.
     */
    private String baseUrl = "http://localhost:8000";

    /**
     * Prefix every endpoint path is resolved against.
     */
    private String apiPath = ApiPaths.DEFAULT_API_PATH;

    /**
     * Unset means the HTTP client default.
     */
    private Duration connectTimeout;

    /**
     * Unset means no read timeout.
     */
    private Duration readTimeout;

    /**
     * A real email verification token, e.g. seeded in the database of the deployment.
     * When present the run also checks a successful and a replayed confirmation.
     */
    private String verificationToken;

    /**
     * Account the verification token was issued to. The run's own user only counts as
     * verified when this matches its email.
     */
    private String verificationTokenEmail;

    private boolean runOnStartup = true;

    public String getApiBaseUrl() {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        if (apiPath == null || apiPath.isBlank()) {
            return base;
        }
        return base + (apiPath.startsWith("/") ? apiPath : "/" + apiPath);
    }
}
