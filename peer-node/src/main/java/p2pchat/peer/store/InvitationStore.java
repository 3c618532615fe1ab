package p2pchat.peer.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import p2pchat.common.exception.DuplicateIdException;
import p2pchat.common.exception.NotFoundException;
import p2pchat.common.exception.StorageException;
import p2pchat.common.model.Invitation;

import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Durable record of invitations keyed by invitation id.
 * Does not check transition legality; {@code InvitationController} owns that.
 */
public class InvitationStore {

    static final String COLLECTION = "invitations";

    private final RecordStore records;
    private final RecordMapper<Invitation> mapper;

    public InvitationStore(RecordStore records, ObjectMapper objectMapper) {
        this.records = Objects.requireNonNull(records);
        this.mapper = new RecordMapper<>(objectMapper, Invitation.class);
    }

    public void create(Invitation invitation) throws DuplicateIdException, StorageException {
        if (!records.putIfAbsent(COLLECTION, invitation.id(), mapper.toDocument(invitation))) {
            throw new DuplicateIdException("Invitation", invitation.id());
        }
    }

    public Invitation get(String id) throws NotFoundException, StorageException {
        return find(id).orElseThrow(() -> new NotFoundException("Invitation", id));
    }

    public Optional<Invitation> find(String id) throws StorageException {
        Optional<JsonNode> document = records.get(COLLECTION, id);
        if (document.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(mapper.fromDocument(document.get()));
    }

    /**
     * Replace the full record.
     */
    public void update(Invitation invitation) throws NotFoundException, StorageException {
        if (!records.contains(COLLECTION, invitation.id())) {
            throw new NotFoundException("Invitation", invitation.id());
        }
        records.put(COLLECTION, invitation.id(), mapper.toDocument(invitation));
    }

    /**
     * Invitations sent by the peer, oldest first. Each call reads a fresh snapshot.
     */
    public Stream<Invitation> listBySender(String peerId) throws StorageException {
        return listAll().filter(invitation -> invitation.senderId().equals(peerId));
    }

    /**
     * Invitations addressed to the peer, oldest first. Each call reads a fresh snapshot.
     */
    public Stream<Invitation> listByRecipient(String peerId) throws StorageException {
        return listAll().filter(invitation -> invitation.recipientId().equals(peerId));
    }

    public Stream<Invitation> listAll() throws StorageException {
        return mapper.fromDocuments(records.values(COLLECTION)).stream()
                .sorted(Comparator.comparingLong(Invitation::createdAt).thenComparing(Invitation::id));
    }
}
