package org.javai.provisioning.lifecycle;

/**
 * How the backend treats a message once it has been handed to a receiver.
 */
public enum ReceiveMode {
    /** The message stays locked on the backend until the receiver settles it. */
    PEEK_LOCK,
    /** The message is removed from the backend as soon as it is delivered. */
    RECEIVE_AND_DELETE
}
