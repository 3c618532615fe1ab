package p2pchat.peer.network;

import p2pchat.common.exception.GatewayException;
import p2pchat.common.model.CancellationPayload;
import p2pchat.common.model.InvitationPayload;
import p2pchat.common.model.Peer;
import p2pchat.common.model.PushNotification;
import p2pchat.common.model.ResponsePayload;
import p2pchat.common.rmi.PeerService;
import p2pchat.peer.notification.NotificationGateway;
import p2pchat.peer.notification.PushNotifications;

import java.rmi.NotBoundException;
import java.rmi.RemoteException;
import java.rmi.registry.LocateRegistry;
import java.rmi.registry.Registry;

/**
 * Delivers notifications straight to the recipient's device over RMI.
 * Delivery counts as confirmed when the remote device reports at least one acceptance.
 */
public class RmiNotificationGateway implements NotificationGateway {

    private final PeerDirectory directory;
    private final PushNotifications notifications;

    public RmiNotificationGateway(PeerDirectory directory, PushNotifications notifications) {
        this.directory = directory;
        this.notifications = notifications;
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
        Peer peer = directory.find(recipientPeerId)
                .orElseThrow(() -> new GatewayException("No known address for peer " + recipientPeerId));
        try {
            Registry registry = LocateRegistry.getRegistry(peer.host(), peer.rmiPort());
            PeerService peerService = (PeerService) registry.lookup(PeerService.SERVICE_NAME);
            int accepted = peerService.deliverNotification(notification);
            return accepted >= 1;
        } catch (RemoteException | NotBoundException e) {
            throw new GatewayException("Cannot reach " + peer + ": " + e.getMessage(), e);
        }
    }
}
