package p2pchat.peer.notification;

import p2pchat.common.exception.GatewayException;
import p2pchat.peer.config.InvitationSettings;

import java.time.Duration;

/**
 * Runs a gateway call up to a bounded number of times, waiting between attempts.
 * A thrown {@link GatewayException}, or any runtime failure of the gateway, counts as an
 * unconfirmed attempt, so callers always get a result to act on.
 */
public class DeliveryRetry {

    @FunctionalInterface
    public interface Attempt {
        boolean deliver() throws GatewayException;
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final InvitationSettings settings;
    private final Sleeper sleeper;

    public DeliveryRetry(InvitationSettings settings) {
        this(settings, duration -> Thread.sleep(duration.toMillis()));
    }

    public DeliveryRetry(InvitationSettings settings, Sleeper sleeper) {
        this.settings = settings;
        this.sleeper = sleeper;
    }

    public int getMaxAttempts() {
        return settings.maxDeliveryAttempts();
    }

    /**
     * Try until confirmed or attempts run out. If the calling thread is interrupted
     * while waiting, no further attempts are made and the interrupt flag is restored.
     */
    public DeliveryResult deliver(String description, Attempt attempt) {
        return deliver(description, attempt, settings.maxDeliveryAttempts());
    }

    /**
     * Single try, used for best-effort notices that gate nothing.
     */
    public DeliveryResult deliverOnce(String description, Attempt attempt) {
        return deliver(description, attempt, 1);
    }

    private DeliveryResult deliver(String description, Attempt attempt, int maxAttempts) {
        Exception lastError = null;
        int made = 0;
        while (made < maxAttempts) {
            made++;
            try {
                if (attempt.deliver()) {
                    if (made > 1) {
                        System.out.println("[Delivery] " + description + " confirmed on attempt " + made);
                    }
                    return new DeliveryResult(true, made, null);
                }
                System.out.println("[Delivery] " + description + ": no device reached (attempt "
                        + made + "/" + maxAttempts + ")");
            } catch (GatewayException | RuntimeException e) {
                lastError = e;
                System.err.println("[Delivery] " + description + " failed (attempt " + made + "/"
                        + maxAttempts + "): " + e.getMessage());
            }

            if (made < maxAttempts) {
                try {
                    sleeper.sleep(settings.delayAfterAttempt(made));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        return new DeliveryResult(false, made, lastError);
    }
}
