package p2pchat.peer.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import p2pchat.common.exception.StorageException;

import java.util.Objects;
import java.util.Optional;

/**
 * Conversation ids seen for an invitation on any earlier channel, keyed by invitation id.
 * Lets the sender recover when a later copy of an acceptance arrives without its id.
 */
public class ConversationIdCache {

    static final String COLLECTION = "conversation_ids";

    private final RecordStore records;

    public ConversationIdCache(RecordStore records) {
        this.records = Objects.requireNonNull(records);
    }

    public void remember(String invitationId, String conversationId) throws StorageException {
        ObjectNode document = JsonNodeFactory.instance.objectNode();
        document.put("invitationId", invitationId);
        document.put("conversationId", conversationId);
        records.put(COLLECTION, invitationId, document);
    }

    public Optional<String> lookup(String invitationId) throws StorageException {
        return records.get(COLLECTION, invitationId)
                .map(document -> document.get("conversationId"))
                .filter(JsonNode::isTextual)
                .map(JsonNode::asText);
    }

    public void forget(String invitationId) throws StorageException {
        records.remove(COLLECTION, invitationId);
    }
}
