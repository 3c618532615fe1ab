package p2pchat.peer.network;

import p2pchat.common.model.Peer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Known network addresses of peer identities.
 */
public class PeerDirectory {

    private final Map<String, Peer> peers = new ConcurrentHashMap<>();

    public void register(Peer peer) {
        peers.put(peer.peerId(), peer);
    }

    public void remove(String peerId) {
        peers.remove(peerId);
    }

    public Optional<Peer> find(String peerId) {
        return Optional.ofNullable(peers.get(peerId));
    }

    public List<Peer> getPeers() {
        return new ArrayList<>(peers.values());
    }
}
