package io.agentrelay.transport;

/**
 * Handle of a live topic subscription. Closing it stops delivery; messages already queued for
 * it are dropped. Closing twice is a no-op.
 */
public interface Subscription extends AutoCloseable {
    String topic();

    boolean isActive();

    @Override
    void close();
}
