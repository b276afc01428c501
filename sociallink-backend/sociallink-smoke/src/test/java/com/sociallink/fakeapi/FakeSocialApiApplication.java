package com.sociallink.fakeapi;

import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * In-memory stand-in for the SocialLink API, started by end-to-end tests on a random port.
 */
@SpringBootApplication
public class FakeSocialApiApplication {
}
