package com.poolmate.backend.modules.draw.application;

import java.time.Duration;

import com.poolmate.backend.modules.draw.domain.EligibilityPolicy;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "app.draw")
public record DrawProperties(
        @DefaultValue("STRICT") EligibilityPolicy eligibilityPolicy,
        @DefaultValue("PT5S") Duration pollInterval,
        @DefaultValue("PT1M") Duration recoveryInterval,
        @DefaultValue("10") int minCancelReasonLength,
        @DefaultValue("5") int retryAfterSeconds,
        @DefaultValue("4") int schedulerPoolSize
) {

    public static DrawProperties defaults() {
        return new DrawProperties(EligibilityPolicy.STRICT, Duration.ofSeconds(5), Duration.ofMinutes(1), 10, 5, 4);
    }

    public DrawProperties withEligibilityPolicy(EligibilityPolicy policy) {
        return new DrawProperties(policy, pollInterval, recoveryInterval, minCancelReasonLength,
                retryAfterSeconds, schedulerPoolSize);
    }

    public DrawProperties withPollInterval(Duration interval) {
        return new DrawProperties(eligibilityPolicy, interval, recoveryInterval, minCancelReasonLength,
                retryAfterSeconds, schedulerPoolSize);
    }
}
