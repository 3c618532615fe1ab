package p2pchat.peer;

import com.fasterxml.jackson.databind.ObjectMapper;
import p2pchat.common.exception.StorageException;
import p2pchat.common.model.Peer;
import p2pchat.common.util.RandomIdGenerator;
import p2pchat.peer.config.InvitationSettings;
import p2pchat.peer.invitation.InvitationController;
import p2pchat.peer.network.PeerDirectory;
import p2pchat.peer.network.PeerServiceImpl;
import p2pchat.peer.network.RMIServer;
import p2pchat.peer.network.RmiNotificationGateway;
import p2pchat.peer.notification.ConsoleNotificationEmitter;
import p2pchat.peer.notification.DeliveryRetry;
import p2pchat.peer.notification.InboundNotificationDispatcher;
import p2pchat.peer.notification.NotificationPayloadParser;
import p2pchat.peer.notification.PushNotifications;
import p2pchat.peer.store.ConversationIdCache;
import p2pchat.peer.store.ConversationStore;
import p2pchat.peer.store.InvitationStore;
import p2pchat.peer.store.JsonFileRecordStore;
import p2pchat.peer.store.JsonSupport;
import p2pchat.peer.store.MessageStore;
import p2pchat.peer.store.RecordStore;

import java.rmi.RemoteException;

/**
 * Main controller for the peer node.
 * Builds the stores, the invitation controller and the RMI transport for one identity.
 */
public class PeerController {

    private final String peerId;
    private final InvitationSettings settings;
    private final PeerDirectory directory = new PeerDirectory();
    private final InvitationController invitations;
    private final InboundNotificationDispatcher dispatcher;
    private final RMIServer rmiServer;

    private volatile boolean started = false;

    public PeerController(String peerId, InvitationSettings settings) throws StorageException {
        this.peerId = peerId;
        this.settings = settings;

        ObjectMapper mapper = JsonSupport.newObjectMapper();
        RecordStore records = new JsonFileRecordStore(settings.dataDirectory().resolve(peerId), mapper);

        this.invitations = new InvitationController(
                peerId,
                new InvitationStore(records, mapper),
                new ConversationStore(records, mapper),
                new MessageStore(records, mapper),
                new ConversationIdCache(records),
                new RmiNotificationGateway(directory, new PushNotifications(mapper)),
                new ConsoleNotificationEmitter(),
                new RandomIdGenerator(),
                new DeliveryRetry(settings));
        this.dispatcher = new InboundNotificationDispatcher(invitations, new NotificationPayloadParser(mapper));
        this.rmiServer = new RMIServer(settings.rmiPort());
    }

    /**
     * Starts the RMI server.
     */
    public synchronized void start() throws RemoteException {
        if (started) {
            throw new IllegalStateException("Peer already started");
        }
        rmiServer.start(new PeerServiceImpl(dispatcher));
        started = true;
        System.out.println("[Peer] " + peerId + " listening on port " + settings.rmiPort());
    }

    public synchronized void stop() {
        if (!started) {
            return;
        }
        rmiServer.stop();
        started = false;
    }

    public void addPeer(Peer peer) {
        directory.register(peer);
    }

    public PeerDirectory getDirectory() {
        return directory;
    }

    public InvitationController getInvitations() {
        return invitations;
    }

    public InboundNotificationDispatcher getDispatcher() {
        return dispatcher;
    }

    public String getPeerId() {
        return peerId;
    }
}
