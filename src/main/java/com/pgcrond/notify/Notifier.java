package com.pgcrond.notify;

import java.io.IOException;

/**
 * Delivers a job report to its recipient.
 */
public interface Notifier {

    /**
     * Send a plain-text message.
     *
     * @param from sender address
     * @param to recipient address (the job table's {@code MAILTO})
     * @param subject subject line
     * @param body message text
     * @throws IOException if the message could not be handed to the transport
     */
    void send(String from, String to, String subject, String body) throws IOException;
}
