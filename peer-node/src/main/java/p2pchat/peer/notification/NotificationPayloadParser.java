package p2pchat.peer.notification;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import p2pchat.common.exception.MalformedPayloadException;
import p2pchat.common.model.CancellationPayload;
import p2pchat.common.model.InvitationPayload;
import p2pchat.common.model.PushNotification;
import p2pchat.common.model.ResponsePayload;
import p2pchat.common.model.ResponseType;

import java.util.List;
import java.util.Map;

/**
 * Turns raw push data maps into typed payloads.
 * <p>
 * This is the only place that knows about the field-name variants older clients and
 * the push platform produce ({@code chatId}, {@code conversationGuid}, {@code status}).
 * Everything past this class works with the strict payload records.
 */
public class NotificationPayloadParser {

    private static final List<String> CONVERSATION_ID_FIELDS =
            List.of("conversationId", "chatId", "conversationGuid", "chat_id");
    private static final List<String> RESPONSE_FIELDS = List.of("response", "status");
    private static final String UNKNOWN_PLACEHOLDER = "unknown";

    private final ObjectMapper mapper;

    public NotificationPayloadParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * The declared {@code type} of a data map.
     */
    public String typeOf(Map<String, Object> data) throws MalformedPayloadException {
        return requiredText(toTree(data), PushNotification.TYPE_KEY);
    }

    /**
     * Parse a response. An acceptance without a usable conversation id is returned with a
     * null {@code conversationId}; the caller decides how to recover.
     */
    public ResponsePayload parseResponse(Map<String, Object> data) throws MalformedPayloadException {
        ObjectNode tree = toTree(data);
        String invitationId = requiredText(tree, "invitationId");
        String responderId = requiredText(tree, "responderId");
        ResponseType response = responseType(tree);
        long timestamp = requiredLong(tree, "timestamp");
        String conversationId = null;
        if (response == ResponseType.ACCEPTED) {
            conversationId = firstText(tree, CONVERSATION_ID_FIELDS);
            if (UNKNOWN_PLACEHOLDER.equalsIgnoreCase(conversationId)) {
                conversationId = null;
            }
        }
        return new ResponsePayload(invitationId, responderId, response, conversationId, timestamp);
    }

    public InvitationPayload parseInvitation(Map<String, Object> data) throws MalformedPayloadException {
        ObjectNode tree = toTree(data);
        return new InvitationPayload(
                requiredText(tree, "invitationId"),
                requiredText(tree, "senderId"),
                requiredText(tree, "recipientId"),
                optionalText(tree, "message"),
                requiredLong(tree, "createdAt"));
    }

    public CancellationPayload parseCancellation(Map<String, Object> data) throws MalformedPayloadException {
        ObjectNode tree = toTree(data);
        return new CancellationPayload(
                requiredText(tree, "invitationId"),
                requiredText(tree, "senderId"),
                requiredLong(tree, "timestamp"));
    }

    private ObjectNode toTree(Map<String, Object> data) throws MalformedPayloadException {
        if (data == null || data.isEmpty()) {
            throw new MalformedPayloadException(null, "Notification carries no data");
        }
        try {
            return mapper.valueToTree(data);
        } catch (IllegalArgumentException e) {
            throw new MalformedPayloadException(null, "Notification data is not a JSON object", e);
        }
    }

    private ResponseType responseType(ObjectNode tree) throws MalformedPayloadException {
        String value = firstText(tree, RESPONSE_FIELDS);
        if (value == null) {
            throw new MalformedPayloadException("response", "Missing field 'response'");
        }
        try {
            return ResponseType.fromWireName(value);
        } catch (IllegalArgumentException e) {
            throw new MalformedPayloadException("response", "Unknown response '" + value + "'", e);
        }
    }

    private static String requiredText(ObjectNode tree, String field) throws MalformedPayloadException {
        String value = optionalText(tree, field);
        if (value == null) {
            throw new MalformedPayloadException(field, "Missing field '" + field + "'");
        }
        return value;
    }

    private static String optionalText(ObjectNode tree, String field) {
        JsonNode node = tree.get(field);
        if (node == null || node.isNull() || !node.isValueNode()) {
            return null;
        }
        String text = node.asText().trim();
        return text.isEmpty() ? null : text;
    }

    private static String firstText(ObjectNode tree, List<String> fields) {
        for (String field : fields) {
            String value = optionalText(tree, field);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static long requiredLong(ObjectNode tree, String field) throws MalformedPayloadException {
        JsonNode node = tree.get(field);
        if (node != null && node.isIntegralNumber()) {
            return node.asLong();
        }
        if (node != null && node.isTextual()) {
            try {
                return Long.parseLong(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new MalformedPayloadException(field, "Field '" + field + "' is not a number", e);
            }
        }
        throw new MalformedPayloadException(field, "Missing field '" + field + "'");
    }
}
