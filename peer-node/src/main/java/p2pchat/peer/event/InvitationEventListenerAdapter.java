package p2pchat.peer.event;

import p2pchat.common.model.Conversation;
import p2pchat.common.model.Invitation;

/**
 * Adapter class with empty default implementations for convenience.
 * Extend this class to only implement the methods you need.
 */
public class InvitationEventListenerAdapter implements InvitationEventListener {

    @Override
    public void onInvitationReceived(Invitation invitation) {
        // Default empty implementation
    }

    @Override
    public void onInvitationUpdated(Invitation invitation) {
        // Default empty implementation
    }

    @Override
    public void onConversationOpened(Conversation conversation) {
        // Default empty implementation
    }

    @Override
    public void onResyncRequired(Invitation invitation, String reason) {
        // Default empty implementation
    }

    @Override
    public void onError(String message, Throwable t) {
        // Default empty implementation
    }

    @Override
    public void onLog(String message) {
        // Default empty implementation
    }
}
