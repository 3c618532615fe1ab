package p2pchat.common.rmi;

import p2pchat.common.model.PushNotification;

import java.rmi.Remote;
import java.rmi.RemoteException;

/**
 * RMI interface exported by every peer device to receive push notifications.
 */
public interface PeerService extends Remote {

    String SERVICE_NAME = "PeerService";

    /**
     * Deliver a notification to this device.
     *
     * @param notification The notification to deliver
     * @return the number of devices that accepted it (0 or 1)
     */
    int deliverNotification(PushNotification notification) throws RemoteException;
}
