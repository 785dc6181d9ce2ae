package com.cra.config;

import com.cra.protocol.RiskTier;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Engine configuration bound from {@code cra.*}. {@link #defaults()} gives
 * the same values for code that runs without a Spring context.
 */
@ConfigurationProperties(prefix = "cra")
public record CraProperties(
    @DefaultValue Trace trace,
    @DefaultValue Resolution resolution,
    @DefaultValue Policy policy
) {

    public static final String ZERO_GENESIS = "0".repeat(64);

    public static CraProperties defaults() {
        return new CraProperties(Trace.defaults(), Resolution.defaults(), Policy.defaults());
    }

    public CraProperties withTrace(Trace trace) {
        return new CraProperties(trace, resolution, policy);
    }

    public CraProperties withResolution(Resolution resolution) {
        return new CraProperties(trace, resolution, policy);
    }

    public CraProperties withPolicy(Policy policy) {
        return new CraProperties(trace, resolution, policy);
    }

    public record Trace(
        @DefaultValue("0000000000000000000000000000000000000000000000000000000000000000") String genesisSeed,
        @DefaultValue("4096") int queueCapacity,
        @DefaultValue("10ms") Duration pollInterval,
        @DefaultValue("5s") Duration flushTimeout
    ) {
        public static Trace defaults() {
            return new Trace(ZERO_GENESIS, 4096, Duration.ofMillis(10), Duration.ofSeconds(5));
        }
    }

    public record Resolution(
        @DefaultValue("300") long defaultTtlSeconds,
        @DefaultValue("10") int maxContextBlocks,
        @DefaultValue("true") boolean parallelEvaluation
    ) {
        public static Resolution defaults() {
            return new Resolution(300, 10, true);
        }
    }

    public record Policy(
        @DefaultValue("critical") RiskTier riskCeiling,
        @DefaultValue("high") RiskTier approvalThreshold,
        @DefaultValue("operator") String defaultApprover,
        @DefaultValue("3600") long defaultApprovalTimeoutSeconds,
        @DefaultValue SessionRateLimit sessionRateLimit
    ) {
        public static Policy defaults() {
            return new Policy(RiskTier.CRITICAL, RiskTier.HIGH, "operator", 3600, SessionRateLimit.defaults());
        }
    }

    /** Session-wide throttle; {@code maxRequests == 0} turns it off. */
    public record SessionRateLimit(
        @DefaultValue("0") int maxRequests,
        @DefaultValue("60s") Duration window
    ) {
        public static SessionRateLimit defaults() {
            return new SessionRateLimit(0, Duration.ofSeconds(60));
        }

        public boolean enabled() {
            return maxRequests > 0;
        }
    }
}
