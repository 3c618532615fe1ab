package p2pchat.common.model;

import java.io.Serial;
import java.io.Serializable;
import java.util.Objects;

/**
 * Sender's notice that a pending invitation was withdrawn.
 */
public record CancellationPayload(String invitationId, String senderId, long timestamp) implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    public static final String TYPE = "invitation_cancelled";

    public CancellationPayload {
        Objects.requireNonNull(invitationId, "invitationId cannot be null");
        Objects.requireNonNull(senderId, "senderId cannot be null");
    }
}
