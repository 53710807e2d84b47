package org.javai.provisioning.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Sole owner of a {@link MessagingFactory} shared by several endpoints.
 *
 * <p>Endpoints borrow the factory through a {@link Lease}. The factory is closed exactly
 * once, when the owner has called {@link #close()} and every lease has been released,
 * in whichever order those happen. No new lease can be taken once the owner has closed.</p>
 */
public final class SharedConnection implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SharedConnection.class);

    private final MessagingFactory factory;
    private int activeLeases;
    private boolean ownerClosed;
    private boolean factoryClosed;

    public SharedConnection(MessagingFactory factory) {
        this.factory = Objects.requireNonNull(factory, "factory must not be null");
    }

    /**
     * Borrows the factory.
     *
     * @throws IllegalStateException if the owner has already closed this connection
     */
    public synchronized Lease lease() {
        if (ownerClosed) {
            throw new IllegalStateException("Shared connection is closed");
        }
        activeLeases++;
        return new Lease();
    }

    public synchronized int activeLeases() {
        return activeLeases;
    }

    public synchronized boolean isFactoryClosed() {
        return factoryClosed;
    }

    /**
     * Starts owner teardown. The factory closes now if no lease is outstanding,
     * otherwise when the last lease is released.
     */
    @Override
    public void close() {
        boolean closeNow;
        synchronized (this) {
            if (ownerClosed) {
                return;
            }
            ownerClosed = true;
            closeNow = claimFactoryClose();
        }
        if (closeNow) {
            closeFactory();
        } else {
            log.debug("Owner closed shared connection; waiting for {} lease(s) before closing factory", activeLeases());
        }
    }

    private void release() {
        boolean closeNow;
        synchronized (this) {
            activeLeases--;
            closeNow = claimFactoryClose();
        }
        if (closeNow) {
            closeFactory();
        }
    }

    // caller holds the monitor
    private boolean claimFactoryClose() {
        if (ownerClosed && activeLeases == 0 && !factoryClosed) {
            factoryClosed = true;
            return true;
        }
        return false;
    }

    private void closeFactory() {
        log.debug("Closing shared messaging factory {}", factory.getClass().getSimpleName());
        factory.close();
    }

    /**
     * A borrowed reference to the shared factory. Releasing is idempotent.
     */
    public final class Lease implements AutoCloseable {

        private final AtomicBoolean released = new AtomicBoolean();

        private Lease() {}

        public MessagingFactory factory() {
            if (released.get()) {
                throw new IllegalStateException("Lease already released");
            }
            return factory;
        }

        public boolean isReleased() {
            return released.get();
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                release();
            }
        }
    }
}
