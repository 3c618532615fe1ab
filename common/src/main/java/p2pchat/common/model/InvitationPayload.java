package p2pchat.common.model;

import java.io.Serial;
import java.io.Serializable;
import java.util.Objects;

/**
 * A new invitation as delivered to the recipient's device.
 */
public record InvitationPayload(
        String invitationId,
        String senderId,
        String recipientId,
        String message,
        long createdAt) implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    public static final String TYPE = "invitation";

    public InvitationPayload {
        Objects.requireNonNull(invitationId, "invitationId cannot be null");
        Objects.requireNonNull(senderId, "senderId cannot be null");
        Objects.requireNonNull(recipientId, "recipientId cannot be null");
        message = message != null ? message : "";
    }

    public static InvitationPayload of(Invitation invitation) {
        return new InvitationPayload(invitation.id(), invitation.senderId(), invitation.recipientId(),
                invitation.message(), invitation.createdAt());
    }
}
