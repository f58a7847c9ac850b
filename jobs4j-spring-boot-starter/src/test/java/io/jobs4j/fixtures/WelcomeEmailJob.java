package io.jobs4j.fixtures;

import io.jobs4j.Dispatchable;
import io.jobs4j.annotation.Queue;

@Queue("emails")
public class WelcomeEmailJob implements Dispatchable<WelcomeEmailJob.Payload> {

    public record Payload(String to) {
    }

    private final Mailbox mailbox;

    public WelcomeEmailJob(Mailbox mailbox) {
        this.mailbox = mailbox;
    }

    @Override
    public void handle(Payload payload) {
        mailbox.deliver(payload.to());
    }
}
