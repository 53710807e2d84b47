package org.javai.provisioning.boundary;

import org.javai.provisioning.FailureId;
import org.javai.provisioning.backend.EntityAlreadyExistsException;
import org.javai.provisioning.backend.EntityNotFoundException;

/**
 * Classifies failures of a create call.
 *
 * <p>Losing the creation race is the expected {@code ENTITY_ALREADY_EXISTS} branch.
 * A not-found answer to a create means the parent namespace is missing, which no
 * retry fixes. Creation mutates the backend, so an unrecognised exception is
 * treated as permanent.</p>
 */
public class CreationFailureClassifier extends TopicAdminFailureClassifier {

    @Override
    protected FailureKind classifyStructural(Throwable t) {
        if (t instanceof EntityAlreadyExistsException) {
            return FailureKind.entityAlreadyExists(FailureId.of("backend", "entity_already_exists"), messageFor("Entity already exists", t));
        }
        if (t instanceof EntityNotFoundException) {
            return FailureKind.permanentFailure(FailureId.of("backend", "parent_not_found"), messageFor("Parent entity not found", t));
        }
        return null;
    }

    @Override
    protected FailureKind classifyUnrecognised(Throwable t) {
        return FailureKind.permanentFailure(unknownId(t),
                t.getMessage() != null ? t.getMessage() : t.getClass().getName());
    }
}
