package p2pchat.peer.notification;

import p2pchat.common.exception.InvitationException;
import p2pchat.common.exception.MalformedPayloadException;
import p2pchat.common.model.CancellationPayload;
import p2pchat.common.model.InvitationPayload;
import p2pchat.common.model.ResponsePayload;
import p2pchat.peer.event.InvitationEventListener;
import p2pchat.peer.invitation.InvitationController;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Entry point for push notifications received by this device. Routes each data map by
 * its {@code type} to the invitation controller. Nothing is dropped silently: every
 * rejected notification is logged and reported to listeners.
 */
public class InboundNotificationDispatcher {

    private final InvitationController controller;
    private final NotificationPayloadParser parser;
    private final List<InvitationEventListener> listeners = new CopyOnWriteArrayList<>();

    public InboundNotificationDispatcher(InvitationController controller, NotificationPayloadParser parser) {
        this.controller = controller;
        this.parser = parser;
    }

    public void addEventListener(InvitationEventListener listener) {
        listeners.add(listener);
    }

    public void removeEventListener(InvitationEventListener listener) {
        listeners.remove(listener);
    }

    /**
     * Apply one notification.
     *
     * @return true if this device took the notification in, false if it was rejected
     */
    public boolean dispatch(Map<String, Object> data) {
        String type = null;
        try {
            type = parser.typeOf(data);
            switch (type) {
                case InvitationPayload.TYPE:
                    controller.handleInvitationReceived(parser.parseInvitation(data));
                    return true;
                case ResponsePayload.TYPE:
                    controller.handleResponse(parser.parseResponse(data));
                    return true;
                case CancellationPayload.TYPE:
                    controller.handleCancellation(parser.parseCancellation(data));
                    return true;
                default:
                    System.out.println("[Inbound] Ignoring notification of type '" + type + "'");
                    return false;
            }
        } catch (MalformedPayloadException e) {
            reportError("Malformed " + (type != null ? type : "notification") + " payload, resync required", e);
            return false;
        } catch (InvitationException e) {
            reportError("Rejected " + type + " notification", e);
            return false;
        }
    }

    private void reportError(String message, Throwable t) {
        System.err.println("[Inbound] " + message + ": " + t.getMessage());
        for (InvitationEventListener listener : listeners) {
            listener.onError(message, t);
        }
    }
}
