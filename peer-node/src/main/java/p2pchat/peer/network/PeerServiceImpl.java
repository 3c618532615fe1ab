package p2pchat.peer.network;

import p2pchat.common.model.PushNotification;
import p2pchat.common.rmi.PeerService;
import p2pchat.peer.notification.InboundNotificationDispatcher;

import java.rmi.RemoteException;
import java.rmi.server.UnicastRemoteObject;

/**
 * Implementation of PeerService RMI interface.
 * Hands incoming notifications to the dispatcher and reports whether this device took them in.
 */
public class PeerServiceImpl extends UnicastRemoteObject implements PeerService {

    private final transient InboundNotificationDispatcher dispatcher;

    public PeerServiceImpl(InboundNotificationDispatcher dispatcher) throws RemoteException {
        super();
        this.dispatcher = dispatcher;
    }

    @Override
    public int deliverNotification(PushNotification notification) throws RemoteException {
        System.out.println("[RMI] Received " + notification);
        return dispatcher.dispatch(notification.getData()) ? 1 : 0;
    }
}
