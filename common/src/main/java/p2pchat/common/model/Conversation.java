package p2pchat.common.model;

import java.io.Serial;
import java.io.Serializable;
import java.util.Objects;

/**
 * Local record of a conversation. The id is shared verbatim by both peers' devices;
 * participantA is always the local identity on the device that owns the record.
 */
public record Conversation(
        String id,
        String participantA,
        String participantB,
        long createdAt,
        long updatedAt,
        String seedMessageId) implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    public Conversation {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(participantA, "participantA cannot be null");
        Objects.requireNonNull(participantB, "participantB cannot be null");
    }

    public static Conversation open(String id, String localPeerId, String remotePeerId, String seedMessageId,
            long at) {
        return new Conversation(id, localPeerId, remotePeerId, at, at, seedMessageId);
    }

    public boolean hasParticipant(String peerId) {
        return participantA.equals(peerId) || participantB.equals(peerId);
    }

    /**
     * Unordered pair comparison.
     */
    public boolean isBetween(String first, String second) {
        return (participantA.equals(first) && participantB.equals(second))
                || (participantA.equals(second) && participantB.equals(first));
    }
}
