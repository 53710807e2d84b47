package org.javai.provisioning.backend;

/**
 * The namespace has reached an entity or size quota.
 */
public class QuotaExceededException extends TopicAdminException {

    public QuotaExceededException(String entityName, String message) {
        super(entityName, message, false);
    }

    public QuotaExceededException(String entityName, String message, Throwable cause) {
        super(entityName, message, false, cause);
    }
}
