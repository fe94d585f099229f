package io.agentrelay.transport;

/**
 * The publish/subscribe fabric could not be reached. Never retried by the broker.
 */
public class TransportException extends RuntimeException {
    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
