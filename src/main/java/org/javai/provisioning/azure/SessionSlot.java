package org.javai.provisioning.azure;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Holds the one session a session receiver works on.
 *
 * <p>Accepting a session blocks until the broker hands one out, so it runs outside the lock.
 * A session that arrives after {@link #close()} is closed straight away, and so is one that
 * lost a race with a concurrent accept.</p>
 */
final class SessionSlot<S> {

    private final Consumer<S> closer;
    private S current;
    private boolean closed;

    SessionSlot(Consumer<S> closer) {
        this.closer = Objects.requireNonNull(closer, "closer");
    }

    S get(Supplier<S> accept) {
        synchronized (this) {
            ensureOpen();
            if (current != null) {
                return current;
            }
        }
        S accepted = accept.get();
        S winner;
        synchronized (this) {
            if (!closed && current == null) {
                current = accepted;
                return accepted;
            }
            winner = closed ? null : current;
        }
        closer.accept(accepted);
        if (winner == null) {
            throw new IllegalStateException("Session receiver closed while accepting a session");
        }
        return winner;
    }

    /**
     * @return false if the slot was already closed
     */
    boolean close() {
        S toClose;
        synchronized (this) {
            if (closed) {
                return false;
            }
            closed = true;
            toClose = current;
            current = null;
        }
        if (toClose != null) {
            closer.accept(toClose);
        }
        return true;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Session receiver is closed");
        }
    }
}
