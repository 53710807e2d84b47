package org.javai.provisioning.backend;

/**
 * Base class of every failure a {@link TopicAdmin} reports.
 *
 * <p>Subclasses name the conditions classifiers recognise. A plain
 * {@code TopicAdminException} is classified by its {@link #isTransient()} flag.</p>
 */
public class TopicAdminException extends Exception {

    private final String entityName;
    private final boolean isTransient;

    public TopicAdminException(String entityName, String message, boolean isTransient) {
        this(entityName, message, isTransient, null);
    }

    public TopicAdminException(String entityName, String message, boolean isTransient, Throwable cause) {
        super(message, cause);
        this.entityName = entityName;
        this.isTransient = isTransient;
    }

    /**
     * The topic the failed call addressed, or null when not known.
     */
    public String entityName() {
        return entityName;
    }

    /**
     * Whether the backend itself flagged the failure as worth retrying.
     */
    public boolean isTransient() {
        return isTransient;
    }
}
