package org.javai.provisioning.backend;

import org.javai.provisioning.TopicDescriptor;

/**
 * The two administrative operations provisioning needs from a pub/sub backend.
 *
 * <p>Implementations translate their SDK's failures into the checked
 * {@link TopicAdminException} hierarchy so that classifiers can reason about them
 * without knowing the SDK. Implementations must be safe for concurrent use.</p>
 */
public interface TopicAdmin {

    /**
     * Looks up an existing topic.
     *
     * @throws EntityNotFoundException if no topic with this name exists
     * @throws TopicAdminException for any other backend failure
     */
    TopicDescriptor getTopic(String name) throws TopicAdminException;

    /**
     * Creates a topic atomically.
     *
     * @throws EntityAlreadyExistsException if a topic with this name already exists
     * @throws TopicAdminException for any other backend failure
     */
    TopicDescriptor createTopic(TopicDescriptor descriptor) throws TopicAdminException;
}
