package p2pchat.peer.notification;

/**
 * Outcome of a bounded delivery sequence.
 *
 * @param delivered whether some attempt was confirmed
 * @param attempts  number of gateway calls made
 * @param lastError the exception of the last failed call, or null
 */
public record DeliveryResult(boolean delivered, int attempts, Exception lastError) {
}
