package org.javai.provisioning.backend;

import java.time.Duration;

/**
 * The backend is throttling the caller or is temporarily unavailable.
 */
public class ServerBusyException extends TopicAdminException {

    private final Duration retryAfter;

    public ServerBusyException(String entityName, String message, Duration retryAfter) {
        this(entityName, message, retryAfter, null);
    }

    public ServerBusyException(String entityName, String message, Duration retryAfter, Throwable cause) {
        super(entityName, message, true, cause);
        this.retryAfter = retryAfter;
    }

    /**
     * The wait the backend asked for, or null if it gave none.
     */
    public Duration retryAfter() {
        return retryAfter;
    }
}
