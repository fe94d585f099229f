package io.agentrelay.broker;

import io.agentrelay.config.AgentRelaySettings;

import java.time.Duration;

/**
 * @param overflowThresholdBytes serialized {@code data} larger than this goes to the result store
 * @param overflowTtl            how long an overflowed result stays retrievable
 */
public record BrokerOptions(long overflowThresholdBytes, Duration overflowTtl) {
    public BrokerOptions {
        if (overflowThresholdBytes < 1L) {
            throw new IllegalArgumentException("overflowThresholdBytes must be positive");
        }
        if (overflowTtl == null || overflowTtl.isNegative() || overflowTtl.isZero()) {
            throw new IllegalArgumentException("overflowTtl must be positive");
        }
    }

    public static BrokerOptions defaults() {
        return from(AgentRelaySettings.defaults());
    }

    public static BrokerOptions from(AgentRelaySettings settings) {
        return new BrokerOptions(settings.overflowThresholdBytes(), settings.overflowTtl());
    }
}
