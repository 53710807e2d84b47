package org.javai.provisioning.boundary;

import org.javai.provisioning.FailureId;
import org.javai.provisioning.backend.BackendTimeoutException;
import org.javai.provisioning.backend.CommunicationException;
import org.javai.provisioning.backend.ConflictingOperationException;
import org.javai.provisioning.backend.InvalidEntityException;
import org.javai.provisioning.backend.QuotaExceededException;
import org.javai.provisioning.backend.ServerBusyException;
import org.javai.provisioning.backend.TopicAdminException;
import org.javai.provisioning.backend.UnauthorizedException;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Shared transient/permanent vocabulary for failures raised by a
 * {@link org.javai.provisioning.backend.TopicAdmin}.
 *
 * <p>The existence-check path and the create path see different structural signals
 * from the backend. Subclasses decide those first through {@link #classifyStructural},
 * and decide what an unrecognised exception means through {@link #classifyUnrecognised}.
 * Everything in between is classified identically for both paths.</p>
 */
public abstract class TopicAdminFailureClassifier implements FailureClassifier {

    static final Duration CONNECT_RETRY_HINT = Duration.ofSeconds(1);

    @Override
    public final FailureKind classify(String operation, Throwable t) {
        FailureKind structural = classifyStructural(t);
        if (structural != null) {
            return structural;
        }

        if (t instanceof ServerBusyException busy) {
            FailureKind kind = FailureKind.transientFailure(
                    FailureId.of("backend", "server_busy"), messageFor("Server busy", t));
            return busy.retryAfter() != null ? kind.withRetryAfter(busy.retryAfter()) : kind;
        }

        if (t instanceof BackendTimeoutException) {
            return FailureKind.transientFailure(FailureId.of("backend", "timeout"), messageFor("Backend timeout", t));
        }

        if (t instanceof CommunicationException) {
            return FailureKind.transientFailure(FailureId.of("backend", "communication"), messageFor("Communication failure", t));
        }

        if (t instanceof ConflictingOperationException) {
            return FailureKind.transientFailure(FailureId.of("backend", "conflicting_operation"), messageFor("Conflicting operation in progress", t));
        }

        if (t instanceof UnauthorizedException) {
            return FailureKind.permanentFailure(FailureId.of("backend", "unauthorized"), messageFor("Unauthorized", t));
        }

        if (t instanceof InvalidEntityException) {
            return FailureKind.permanentFailure(FailureId.of("backend", "invalid_entity"), messageFor("Invalid entity", t));
        }

        if (t instanceof QuotaExceededException) {
            return FailureKind.permanentFailure(FailureId.of("backend", "quota_exceeded"), messageFor("Quota exceeded", t));
        }

        if (t instanceof TopicAdminException admin) {
            return admin.isTransient()
                    ? FailureKind.transientFailure(FailureId.of("backend", "transient"), messageFor("Backend error", t))
                    : FailureKind.permanentFailure(FailureId.of("backend", "error"), messageFor("Backend error", t));
        }

        // Network
        if (t instanceof SocketTimeoutException) {
            return FailureKind.transientFailure(FailureId.of("network", "timeout"), messageFor("Socket timeout", t));
        }

        if (t instanceof ConnectException) {
            return FailureKind.transientFailure(FailureId.of("network", "connection_refused"), messageFor("Connection refused", t))
                    .withRetryAfter(CONNECT_RETRY_HINT);
        }

        if (t instanceof UnknownHostException) {
            return FailureKind.permanentFailure(FailureId.of("network", "unknown_host"), messageFor("Unknown host", t));
        }

        if (t instanceof TimeoutException) {
            return FailureKind.transientFailure(FailureId.of("operation", "timeout"), messageFor("Operation timeout", t));
        }

        if (t instanceof IOException) {
            return FailureKind.transientFailure(FailureId.of("io", "io_error"), messageFor("IO error", t));
        }

        return classifyUnrecognised(t);
    }

    /**
     * Classifies the not-found/already-exists signals for this path.
     *
     * @return the classification, or null if {@code t} is not a structural signal
     */
    protected abstract FailureKind classifyStructural(Throwable t);

    /**
     * Classifies an exception none of the shared rules recognised.
     */
    protected abstract FailureKind classifyUnrecognised(Throwable t);

    protected static String messageFor(String prefix, Throwable t) {
        return t.getMessage() != null ? prefix + ": " + t.getMessage() : prefix;
    }

    protected static FailureId unknownId(Throwable t) {
        return FailureId.of("unknown", t.getClass().getSimpleName());
    }
}
