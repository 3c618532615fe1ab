package p2pchat.peer.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Tunables for invitation handling on one device.
 */
public record InvitationSettings(
        int maxDeliveryAttempts,
        Duration retryDelay,
        Backoff backoff,
        Path dataDirectory,
        int rmiPort) {

    /**
     * Attempts made for a response notification before the local change is rolled back.
     */
    public static final int DEFAULT_MAX_DELIVERY_ATTEMPTS = 3;

    /**
     * Wait between two delivery attempts (multiplied by the attempt number for LINEAR).
     */
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(2);

    public static final Path DEFAULT_DATA_DIRECTORY = Path.of("p2pchat-data");

    public static final int DEFAULT_RMI_PORT = 1100;

    public enum Backoff {
        FIXED,
        LINEAR
    }

    public InvitationSettings {
        if (maxDeliveryAttempts < 1) {
            throw new IllegalArgumentException("maxDeliveryAttempts must be at least 1");
        }
        Objects.requireNonNull(retryDelay, "retryDelay cannot be null");
        if (retryDelay.isNegative()) {
            throw new IllegalArgumentException("retryDelay cannot be negative");
        }
        Objects.requireNonNull(backoff, "backoff cannot be null");
        Objects.requireNonNull(dataDirectory, "dataDirectory cannot be null");
    }

    public static InvitationSettings defaults() {
        return new InvitationSettings(
                DEFAULT_MAX_DELIVERY_ATTEMPTS,
                DEFAULT_RETRY_DELAY,
                Backoff.FIXED,
                DEFAULT_DATA_DIRECTORY,
                DEFAULT_RMI_PORT);
    }

    public InvitationSettings withRetry(int attempts, Duration delay, Backoff backoff) {
        return new InvitationSettings(attempts, delay, backoff, dataDirectory, rmiPort);
    }

    public InvitationSettings withDataDirectory(Path directory) {
        return new InvitationSettings(maxDeliveryAttempts, retryDelay, backoff, directory, rmiPort);
    }

    public InvitationSettings withRmiPort(int port) {
        return new InvitationSettings(maxDeliveryAttempts, retryDelay, backoff, dataDirectory, port);
    }

    /**
     * Delay to wait after the given failed attempt (1-based).
     */
    public Duration delayAfterAttempt(int attempt) {
        return backoff == Backoff.LINEAR ? retryDelay.multipliedBy(attempt) : retryDelay;
    }
}
