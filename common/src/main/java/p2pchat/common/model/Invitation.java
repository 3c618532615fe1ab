package p2pchat.common.model;

import java.io.Serial;
import java.io.Serializable;
import java.util.Objects;

/**
 * A one-directional request from a sender to a recipient to open a conversation.
 * Immutable: every state change yields a new value that replaces the stored record.
 */
public record Invitation(
        String id,
        String senderId,
        String recipientId,
        String message,
        InvitationStatus status,
        long createdAt,
        Long respondedAt,
        String conversationId,
        boolean resyncRequired) implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    public Invitation {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(senderId, "senderId cannot be null");
        Objects.requireNonNull(recipientId, "recipientId cannot be null");
        Objects.requireNonNull(status, "status cannot be null");
        message = message != null ? message : "";
        if (conversationId != null && status != InvitationStatus.ACCEPTED) {
            throw new IllegalArgumentException("conversationId is only allowed on accepted invitations");
        }
    }

    public static Invitation pending(String id, String senderId, String recipientId, String message, long createdAt) {
        return new Invitation(id, senderId, recipientId, message, InvitationStatus.PENDING, createdAt,
                null, null, false);
    }

    public boolean isPending() {
        return status == InvitationStatus.PENDING;
    }

    public boolean isSentBy(String peerId) {
        return senderId.equals(peerId);
    }

    public boolean isAddressedTo(String peerId) {
        return recipientId.equals(peerId);
    }

    /**
     * The identity on the other side of this invitation, seen from {@code localPeerId}.
     */
    public String counterpartOf(String localPeerId) {
        return isSentBy(localPeerId) ? recipientId : senderId;
    }

    public Invitation accept(String conversationId, long at) {
        Objects.requireNonNull(conversationId, "conversationId cannot be null");
        return new Invitation(id, senderId, recipientId, message, InvitationStatus.ACCEPTED, createdAt,
                at, conversationId, false);
    }

    /**
     * Accepted on the sender side without a usable conversation id.
     */
    public Invitation acceptAwaitingResync(long at) {
        return new Invitation(id, senderId, recipientId, message, InvitationStatus.ACCEPTED, createdAt,
                at, null, true);
    }

    public Invitation decline(long at) {
        return new Invitation(id, senderId, recipientId, message, InvitationStatus.DECLINED, createdAt,
                at, null, false);
    }

    public Invitation cancel(long at) {
        return new Invitation(id, senderId, recipientId, message, InvitationStatus.CANCELLED, createdAt,
                at, null, false);
    }

    @Override
    public String toString() {
        return String.format("Invitation{id='%s', sender='%s', recipient='%s', status=%s, conversation='%s'}",
                id, senderId, recipientId, status, conversationId);
    }
}
