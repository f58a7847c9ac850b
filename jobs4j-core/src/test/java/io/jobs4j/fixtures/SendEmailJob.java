package io.jobs4j.fixtures;

import io.jobs4j.Dispatchable;
import io.jobs4j.annotation.Queue;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

@Queue("emails")
public class SendEmailJob implements Dispatchable<SendEmailJob.Email> {

    public static final List<Email> HANDLED = new CopyOnWriteArrayList<>();

    public record Email(String to, String subject) {
    }

    @Override
    public void handle(Email payload) {
        HANDLED.add(payload);
    }
}
