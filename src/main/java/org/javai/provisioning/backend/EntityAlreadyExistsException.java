package org.javai.provisioning.backend;

/**
 * An entity with the requested name already exists.
 */
public class EntityAlreadyExistsException extends TopicAdminException {

    public EntityAlreadyExistsException(String entityName, String message) {
        super(entityName, message, false);
    }

    public EntityAlreadyExistsException(String entityName, String message, Throwable cause) {
        super(entityName, message, false, cause);
    }
}
