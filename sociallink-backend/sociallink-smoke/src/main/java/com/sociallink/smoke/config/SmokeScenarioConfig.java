package com.sociallink.smoke.config;

import com.sociallink.schema.domain.validation.PayloadValidator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class SmokeScenarioConfig {

    @Bean
    public PayloadValidator payloadValidator() {
        return PayloadValidator.createDefault();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
