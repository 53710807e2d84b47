package org.javai.provisioning.lifecycle;

/**
 * A backend client privately owned by one sender or receiver.
 */
public interface MessagingClient extends AutoCloseable {

    /**
     * Releases the client. Must be idempotent.
     */
    @Override
    void close();
}
