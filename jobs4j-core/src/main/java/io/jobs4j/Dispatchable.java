package io.jobs4j;

/**
 * A job handler that is invoked on demand with a payload.
 *
 * <p>Implementations live under the configured jobs path and are registered by auto-discovery
 * as a worker for their resolved job name. The payload stored by the engine is converted to
 * {@code T} before {@link #handle(Object)} is called.
 *
 * <pre>{@code
 * @Queue("emails")
 * public class SendEmailJob implements Dispatchable<SendEmailJob.Payload> {
 *     public record Payload(String to, String subject) {}
 *
 *     @Override
 *     public void handle(Payload payload) {
 *         ...
 *     }
 * }
 * }</pre>
 */
public interface Dispatchable<T> {

    void handle(T payload) throws Exception;
}
