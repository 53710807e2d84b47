package org.javai.provisioning.topic;

/**
 * Steps of a single provisioning run. {@link #READY} and {@link #FAILED} are terminal.
 */
public enum ProvisioningState {
    UNKNOWN,
    CHECKING,
    FOUND,
    NOT_FOUND,
    CREATING,
    CREATED,
    CONFLICT_EXISTS,
    READY,
    FAILED;

    public boolean isTerminal() {
        return this == READY || this == FAILED;
    }
}
