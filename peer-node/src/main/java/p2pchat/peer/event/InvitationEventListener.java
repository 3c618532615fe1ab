package p2pchat.peer.event;

import p2pchat.common.model.Conversation;
import p2pchat.common.model.Invitation;

/**
 * Listener interface for invitation events.
 * Decouples the invitation logic from the UI/Presentation layer.
 */
public interface InvitationEventListener {

    /**
     * Called when an invitation from another peer has been stored.
     */
    void onInvitationReceived(Invitation invitation);

    /**
     * Called after a state change of an invitation has been durably committed,
     * including a compensating revert to pending.
     */
    void onInvitationUpdated(Invitation invitation);

    /**
     * Called when a conversation record was created on this device.
     */
    void onConversationOpened(Conversation conversation);

    /**
     * Called when an accepted invitation has no conversation and needs a manual resync.
     */
    void onResyncRequired(Invitation invitation, String reason);

    /**
     * Called when an error occurs.
     */
    void onError(String message, Throwable t);

    /**
     * Called for general log messages.
     */
    void onLog(String message);
}
