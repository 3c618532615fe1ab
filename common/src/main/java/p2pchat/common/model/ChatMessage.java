package p2pchat.common.model;

import java.io.Serial;
import java.io.Serializable;
import java.util.Objects;

/**
 * A message inside a conversation. Seed messages use {@link #SYSTEM_SENDER} as sender.
 */
public record ChatMessage(
        String id,
        String conversationId,
        String senderId,
        String content,
        long createdAt) implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    public static final String SYSTEM_SENDER = "system";

    public ChatMessage {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(conversationId, "conversationId cannot be null");
        Objects.requireNonNull(senderId, "senderId cannot be null");
        content = content != null ? content : "";
    }

    public static ChatMessage seed(String id, String conversationId, String remotePeerId, long at) {
        return new ChatMessage(id, conversationId, SYSTEM_SENDER,
                "You are now connected with " + remotePeerId + ". Start chatting!", at);
    }

    public boolean isSystem() {
        return SYSTEM_SENDER.equals(senderId);
    }
}
