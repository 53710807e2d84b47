package org.javai.provisioning.backend;

/**
 * The request was malformed, e.g. an illegal topic name.
 */
public class InvalidEntityException extends TopicAdminException {

    public InvalidEntityException(String entityName, String message) {
        super(entityName, message, false);
    }

    public InvalidEntityException(String entityName, String message, Throwable cause) {
        super(entityName, message, false, cause);
    }
}
