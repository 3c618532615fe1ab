package p2pchat.peer.util;

import p2pchat.common.exception.GatewayException;
import p2pchat.common.model.CancellationPayload;
import p2pchat.common.model.InvitationPayload;
import p2pchat.common.model.PushNotification;
import p2pchat.common.model.ResponsePayload;
import p2pchat.peer.notification.InboundNotificationDispatcher;
import p2pchat.peer.notification.NotificationGateway;
import p2pchat.peer.notification.NotificationPayloadParser;
import p2pchat.peer.notification.PushNotifications;
import p2pchat.peer.store.JsonSupport;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process push channel between test devices. Notifications go through the same
 * data-map encoding and inbound dispatch as the RMI path.
 */
public class LoopbackGateway implements NotificationGateway {

    private final PushNotifications notifications = new PushNotifications(JsonSupport.newObjectMapper());
    private final Map<String, InboundNotificationDispatcher> devices = new ConcurrentHashMap<>();
    private final Set<String> offline = ConcurrentHashMap.newKeySet();
    private volatile Runnable beforeEachDelivery = () -> { };

    public TestDevice join(String peerId) {
        TestDevice device = new TestDevice(peerId, this);
        devices.put(peerId, new InboundNotificationDispatcher(device.controller,
                new NotificationPayloadParser(device.mapper)));
        return device;
    }

    public void setOnline(String peerId, boolean online) {
        if (online) {
            offline.remove(peerId);
        } else {
            offline.add(peerId);
        }
    }

    /**
     * Run a hook on the sending thread before every delivery.
     */
    public void beforeEachDelivery(Runnable hook) {
        this.beforeEachDelivery = hook;
    }

    @Override
    public boolean sendResponse(String recipientPeerId, ResponsePayload payload) throws GatewayException {
        return deliver(recipientPeerId, notifications.response(payload));
    }

    @Override
    public boolean sendInvitation(String recipientPeerId, InvitationPayload payload) throws GatewayException {
        return deliver(recipientPeerId, notifications.invitation(payload));
    }

    @Override
    public boolean sendCancellation(String recipientPeerId, CancellationPayload payload) throws GatewayException {
        return deliver(recipientPeerId, notifications.cancellation(payload));
    }

    private boolean deliver(String recipientPeerId, PushNotification notification) throws GatewayException {
        beforeEachDelivery.run();
        InboundNotificationDispatcher dispatcher = devices.get(recipientPeerId);
        if (dispatcher == null) {
            throw new GatewayException("Unknown peer " + recipientPeerId);
        }
        if (offline.contains(recipientPeerId)) {
            return false;
        }
        return dispatcher.dispatch(notification.getData());
    }
}
