package io.agentrelay.transport;

import java.util.function.Consumer;

/**
 * Fire-and-forget publish/subscribe fabric.
 *
 * <p>Messages are opaque strings. A message is handed only to subscriptions that were registered
 * before it was published; with no subscriber it is silently dropped. Listeners of a single
 * subscription are invoked serially, in delivery order, on transport-owned threads.
 */
public interface TaskChannelTransport extends AutoCloseable {

    /**
     * @return number of subscriptions the message was handed to
     * @throws TransportException when the fabric is closed or unreachable
     */
    long publish(String topic, String message);

    Subscription subscribe(String topic, Consumer<String> listener);

    /**
     * Competing-consumer subscription: each message on {@code topic} goes to exactly one of the
     * shared subscribers. A subscriber whose listener is still busy is not handed new messages.
     */
    Subscription subscribeShared(String topic, Consumer<String> listener);

    @Override
    void close();
}
