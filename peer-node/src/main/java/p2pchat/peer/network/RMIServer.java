package p2pchat.peer.network;

import p2pchat.common.rmi.PeerService;

import java.rmi.NotBoundException;
import java.rmi.RemoteException;
import java.rmi.registry.LocateRegistry;
import java.rmi.registry.Registry;
import java.rmi.server.ExportException;
import java.rmi.server.UnicastRemoteObject;

/**
 * Manages the RMI server for this peer.
 */
public class RMIServer {

    private final int port;
    private PeerService service;
    private Registry registry;
    private boolean ownsRegistry;

    public RMIServer(int port) {
        this.port = port;
    }

    /**
     * Start the RMI server and export the service.
     */
    public void start(PeerService serviceImpl) throws RemoteException {
        this.service = serviceImpl;
        try {
            this.registry = LocateRegistry.createRegistry(port);
            this.ownsRegistry = true;
        } catch (ExportException e) {
            // Registry already exists, get it
            this.registry = LocateRegistry.getRegistry(port);
        }
        registry.rebind(PeerService.SERVICE_NAME, service);
        System.out.println("[RMI] Server started on port " + port);
    }

    /**
     * Stop the RMI server.
     */
    public void stop() {
        if (registry != null) {
            try {
                registry.unbind(PeerService.SERVICE_NAME);
            } catch (NotBoundException e) {
                System.out.println("[RMI] Service was not bound");
            } catch (RemoteException e) {
                System.err.println("[RMI] Error unbinding service: " + e.getMessage());
            }
        }
        if (service != null) {
            try {
                UnicastRemoteObject.unexportObject(service, true);
            } catch (RemoteException e) {
                System.err.println("[RMI] Error stopping server: " + e.getMessage());
            }
        }
        if (ownsRegistry) {
            try {
                UnicastRemoteObject.unexportObject(registry, true);
            } catch (RemoteException e) {
                System.err.println("[RMI] Error closing registry: " + e.getMessage());
            }
            ownsRegistry = false;
        }
        registry = null;
        service = null;
    }
}
