package p2pchat.common.model;

import java.io.Serial;
import java.io.Serializable;
import java.util.Objects;

/**
 * Network address of a peer identity, used by the RMI transport to reach its device.
 */
public record Peer(String peerId, String host, int rmiPort) implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    public Peer {
        Objects.requireNonNull(peerId, "peerId cannot be null");
        Objects.requireNonNull(host, "host cannot be null");
        if (rmiPort <= 0 || rmiPort > 65535) {
            throw new IllegalArgumentException("invalid rmiPort: " + rmiPort);
        }
    }

    /**
     * Parses {@code id@host:port}.
     */
    public static Peer parse(String address) {
        int at = address.indexOf('@');
        int colon = address.lastIndexOf(':');
        if (at <= 0 || colon <= at + 1 || colon == address.length() - 1) {
            throw new IllegalArgumentException("Expected id@host:port but got '" + address + "'");
        }
        return new Peer(address.substring(0, at), address.substring(at + 1, colon),
                Integer.parseInt(address.substring(colon + 1)));
    }

    @Override
    public String toString() {
        return String.format("Peer{id='%s', host='%s', port=%d}", peerId, host, rmiPort);
    }
}
