package p2pchat.peer.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import p2pchat.common.exception.DuplicateIdException;
import p2pchat.common.exception.StorageException;
import p2pchat.common.model.Conversation;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Durable record of the conversations known on this device.
 */
public class ConversationStore {

    static final String COLLECTION = "conversations";

    private final RecordStore records;
    private final RecordMapper<Conversation> mapper;

    public ConversationStore(RecordStore records, ObjectMapper objectMapper) {
        this.records = Objects.requireNonNull(records);
        this.mapper = new RecordMapper<>(objectMapper, Conversation.class);
    }

    public void create(Conversation conversation) throws DuplicateIdException, StorageException {
        if (!records.putIfAbsent(COLLECTION, conversation.id(), mapper.toDocument(conversation))) {
            throw new DuplicateIdException("Conversation", conversation.id());
        }
    }

    /**
     * Delete a conversation. Deleting an absent id is a no-op.
     *
     * @return true if a record was removed
     */
    public boolean delete(String id) throws StorageException {
        return records.remove(COLLECTION, id);
    }

    public Optional<Conversation> find(String id) throws StorageException {
        Optional<JsonNode> document = records.get(COLLECTION, id);
        if (document.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(mapper.fromDocument(document.get()));
    }

    /**
     * Find the conversation between two peers, regardless of argument order.
     * If several exist the most recently created one is returned.
     */
    public Optional<Conversation> findByParticipants(String a, String b) throws StorageException {
        return mapper.fromDocuments(records.values(COLLECTION)).stream()
                .filter(conversation -> conversation.isBetween(a, b))
                .max(Comparator.comparingLong(Conversation::createdAt));
    }

    public List<Conversation> listFor(String peerId) throws StorageException {
        return mapper.fromDocuments(records.values(COLLECTION)).stream()
                .filter(conversation -> conversation.hasParticipant(peerId))
                .sorted(Comparator.comparingLong(Conversation::updatedAt).reversed())
                .collect(Collectors.toList());
    }
}
