package org.javai.provisioning.lifecycle;

import java.time.Duration;
import java.util.List;

/**
 * Pulls messages from one subscription of a topic.
 *
 * <p>Plain and session-aware backends each get their own adapter behind this interface.</p>
 */
public interface MessageReceiver extends MessagingClient {

    /**
     * Waits up to {@code maxWait} for at most {@code maxMessages} messages.
     *
     * @return the messages received, possibly none
     */
    List<InboundMessage> receive(int maxMessages, Duration maxWait);

    int prefetchCount();

    ReceiveMode mode();
}
