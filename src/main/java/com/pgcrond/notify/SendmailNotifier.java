package com.pgcrond.notify;

import com.pgcrond.exec.ProcessResult;
import com.pgcrond.exec.ProcessRunner;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Notifier that hands messages to the local mail transport agent.
 *
 * <p>The message is written to {@code sendmail -t -oi}, which takes the recipient
 * from the {@code To:} header and does not treat a lone dot as end of input.</p>
 */
public class SendmailNotifier implements Notifier {
    private static final Logger logger = Logger.getLogger(SendmailNotifier.class.getName());

    public static final String DEFAULT_SENDMAIL = "/usr/sbin/sendmail";

    private final ProcessRunner processRunner;
    private final String sendmail;

    public SendmailNotifier(ProcessRunner processRunner, String sendmail) {
        this.processRunner = processRunner;
        this.sendmail = sendmail;
    }

    @Override
    public void send(String from, String to, String subject, String body) throws IOException {
        String message = buildMessage(from, to, subject, body);
        ProcessResult result = processRunner.run(List.of(sendmail, "-t", "-oi"), Map.of(), message);
        if (result.getExitCode() != 0) {
            throw new IOException(sendmail + " exited with " + result.getExitCode() + ": " + result.getOutput().trim());
        }
        logger.info("Report sent to " + to + ": " + subject);
    }

    public static String buildMessage(String from, String to, String subject, String body) {
        StringBuilder message = new StringBuilder();
        message.append("From: ").append(headerValue(from)).append('\n');
        message.append("To: ").append(headerValue(to)).append('\n');
        message.append("Subject: ").append(headerValue(subject)).append('\n');
        message.append("Content-Type: text/plain; charset=UTF-8\n");
        message.append("X-Mailer: pgcrond\n");
        message.append('\n');
        message.append(body);
        if (!body.endsWith("\n")) {
            message.append('\n');
        }
        return message.toString();
    }

    // Header injection guard: a value never spans lines
    private static String headerValue(String value) {
        return value.replaceAll("[\\r\\n]+", " ");
    }
}
