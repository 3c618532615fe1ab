package p2pchat.common.exception;

import java.io.Serial;

/**
 * Thrown after the notification gateway exhausted its attempts without a confirmed
 * delivery. By the time this is thrown the local state has been reverted.
 */
public class RecipientUnreachableException extends InvitationException {

    @Serial
    private static final long serialVersionUID = 1L;

    private final String peerId;
    private final int attempts;

    public RecipientUnreachableException(String peerId, int attempts) {
        super("Unable to reach " + peerId
                + ". They may be offline or have notifications disabled. Please try again later.");
        this.peerId = peerId;
        this.attempts = attempts;
    }

    public String getPeerId() {
        return peerId;
    }

    public int getAttempts() {
        return attempts;
    }
}
