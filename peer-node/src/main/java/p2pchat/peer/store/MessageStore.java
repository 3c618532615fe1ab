package p2pchat.peer.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import p2pchat.common.exception.DuplicateIdException;
import p2pchat.common.exception.StorageException;
import p2pchat.common.model.ChatMessage;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Durable record of conversation messages.
 */
public class MessageStore {

    static final String COLLECTION = "messages";

    private final RecordStore records;
    private final RecordMapper<ChatMessage> mapper;

    public MessageStore(RecordStore records, ObjectMapper objectMapper) {
        this.records = Objects.requireNonNull(records);
        this.mapper = new RecordMapper<>(objectMapper, ChatMessage.class);
    }

    public void append(ChatMessage message) throws DuplicateIdException, StorageException {
        if (!records.putIfAbsent(COLLECTION, message.id(), mapper.toDocument(message))) {
            throw new DuplicateIdException("Message", message.id());
        }
    }

    /**
     * Delete one message. Deleting an absent id is a no-op.
     */
    public boolean delete(String id) throws StorageException {
        return records.remove(COLLECTION, id);
    }

    public List<ChatMessage> listByConversation(String conversationId) throws StorageException {
        return mapper.fromDocuments(records.values(COLLECTION)).stream()
                .filter(message -> message.conversationId().equals(conversationId))
                .sorted(Comparator.comparingLong(ChatMessage::createdAt).thenComparing(ChatMessage::id))
                .collect(Collectors.toList());
    }

    /**
     * Remove every message of a conversation.
     *
     * @return the number of messages removed
     */
    public int deleteByConversation(String conversationId) throws StorageException {
        int removed = 0;
        for (ChatMessage message : listByConversation(conversationId)) {
            if (records.remove(COLLECTION, message.id())) {
                removed++;
            }
        }
        return removed;
    }
}
