package org.javai.provisioning.backend;

/**
 * Another management operation on the same entity is in progress.
 */
public class ConflictingOperationException extends TopicAdminException {

    public ConflictingOperationException(String entityName, String message) {
        super(entityName, message, true);
    }

    public ConflictingOperationException(String entityName, String message, Throwable cause) {
        super(entityName, message, true, cause);
    }
}
