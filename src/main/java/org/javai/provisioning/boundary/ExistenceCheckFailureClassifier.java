package org.javai.provisioning.boundary;

import org.javai.provisioning.FailureId;
import org.javai.provisioning.backend.EntityAlreadyExistsException;
import org.javai.provisioning.backend.EntityNotFoundException;

/**
 * Classifies failures of an existence lookup.
 *
 * <p>A missing topic is the expected {@code ENTITY_NOT_FOUND} branch. A lookup is
 * read-only, so an exception nothing else recognises is assumed transient.</p>
 */
public class ExistenceCheckFailureClassifier extends TopicAdminFailureClassifier {

    @Override
    protected FailureKind classifyStructural(Throwable t) {
        if (t instanceof EntityNotFoundException) {
            return FailureKind.entityNotFound(FailureId.of("backend", "entity_not_found"), messageFor("Entity not found", t));
        }
        if (t instanceof EntityAlreadyExistsException) {
            return FailureKind.permanentFailure(FailureId.of("backend", "unexpected_conflict"),
                    messageFor("Lookup reported an existing entity as a conflict", t));
        }
        return null;
    }

    @Override
    protected FailureKind classifyUnrecognised(Throwable t) {
        return FailureKind.transientFailure(unknownId(t),
                t.getMessage() != null ? t.getMessage() : t.getClass().getName());
    }
}
