package com.edudata.authservice.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.validation.BindValidationException;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class AuthPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropertiesConfig.class);

    @Configuration(proxyBeanMethods = false)
    @EnableConfigurationProperties(AuthProperties.class)
    static class PropertiesConfig {
    }

    @Test
    void bindsEnvironmentStyleDurations() {
        runner.withPropertyValues(
                        "auth.otc.ttl=5m",
                        "auth.rate-limit.window=10m",
                        "auth.challenge.retention=24h")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    AuthProperties props = context.getBean(AuthProperties.class);
                    assertThat(props.getOtc().getTtl()).isEqualTo(Duration.ofMinutes(5));
                    assertThat(props.getChallenge().getRetention()).isEqualTo(Duration.ofHours(24));
                    assertThat(props.isRetentionCoveringRateWindow()).isTrue();
                });
    }

    @Test
    void retentionShorterThanRateWindowFailsStartup() {
        runner.withPropertyValues(
                        "auth.rate-limit.window=30m",
                        "auth.challenge.retention=10m")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .hasRootCauseInstanceOf(BindValidationException.class)
                            .rootCause()
                            .hasMessageContaining("auth.challenge.retention must be >= auth.rate-limit.window");
                });
    }

    @Test
    void retentionEqualToRateWindowIsAccepted() {
        runner.withPropertyValues(
                        "auth.rate-limit.window=10m",
                        "auth.challenge.retention=10m")
                .run(context -> assertThat(context).hasNotFailed());
    }

    @Test
    void otcLengthOutsideRangeFailsStartup() {
        runner.withPropertyValues("auth.otc.length=3")
                .run(context -> assertThat(context).hasFailed());
    }
}
