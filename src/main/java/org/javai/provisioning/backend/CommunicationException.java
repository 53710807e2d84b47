package org.javai.provisioning.backend;

/**
 * The client could not talk to the backend, or the backend failed internally.
 */
public class CommunicationException extends TopicAdminException {

    public CommunicationException(String entityName, String message) {
        super(entityName, message, true);
    }

    public CommunicationException(String entityName, String message, Throwable cause) {
        super(entityName, message, true, cause);
    }
}
