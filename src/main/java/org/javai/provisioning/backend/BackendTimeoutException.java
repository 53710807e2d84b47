package org.javai.provisioning.backend;

/**
 * The backend did not answer within the client timeout.
 */
public class BackendTimeoutException extends TopicAdminException {

    public BackendTimeoutException(String entityName, String message) {
        super(entityName, message, true);
    }

    public BackendTimeoutException(String entityName, String message, Throwable cause) {
        super(entityName, message, true, cause);
    }
}
