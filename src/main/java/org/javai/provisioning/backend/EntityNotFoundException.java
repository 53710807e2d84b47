package org.javai.provisioning.backend;

/**
 * The named entity does not exist.
 */
public class EntityNotFoundException extends TopicAdminException {

    public EntityNotFoundException(String entityName, String message) {
        super(entityName, message, false);
    }

    public EntityNotFoundException(String entityName, String message, Throwable cause) {
        super(entityName, message, false, cause);
    }
}
