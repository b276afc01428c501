package com.sociallink.smoke;

import com.sociallink.smoke.config.SmokeProperties;
import com.sociallink.smoke.runner.SmokeCommandLineRunner;
import com.sociallink.smoke.runner.SmokeTestRunner;
import com.sociallink.smoke.scenario.SmokeScenario;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "sociallink.smoke.base-url=http://smoke-target:8000",
        "sociallink.smoke.read-timeout=5s"
})
@ActiveProfiles("test")
class SmokeApplicationContextTest {

    @Autowired
    ApplicationContext context;

    @Autowired
    SmokeProperties properties;

    @Test
    void wiresTheScenarioWithoutRunningIt() {
        assertThat(context.getBean(SmokeTestRunner.class)).isNotNull();
        assertThat(context.getBean(SmokeScenario.class).getSteps()).hasSize(18);
        assertThat(context.getBeansOfType(SmokeCommandLineRunner.class)).isEmpty();
    }

    @Test
    void bindsSmokeProperties() {
        assertThat(properties.getApiBaseUrl()).isEqualTo("http://smoke-target:8000/api");
        assertThat(properties.getReadTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(properties.isRunOnStartup()).isFalse();
    }
}
