package org.javai.provisioning.backend;

/**
 * The caller is not allowed to perform the operation.
 */
public class UnauthorizedException extends TopicAdminException {

    public UnauthorizedException(String entityName, String message) {
        super(entityName, message, false);
    }

    public UnauthorizedException(String entityName, String message, Throwable cause) {
        super(entityName, message, false, cause);
    }
}
