package p2pchat.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serial;
import java.io.Serializable;
import java.util.Objects;

/**
 * Response to an invitation, delivered from the recipient's device to the sender's device.
 * For an acceptance the conversation id is the only thing that lets the sender find the
 * shared conversation, so the sender adopts it verbatim.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResponsePayload(
        String invitationId,
        String responderId,
        ResponseType response,
        String conversationId,
        long timestamp) implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    public static final String TYPE = "invitation_response";

    public ResponsePayload {
        Objects.requireNonNull(invitationId, "invitationId cannot be null");
        Objects.requireNonNull(responderId, "responderId cannot be null");
        Objects.requireNonNull(response, "response cannot be null");
        if (response == ResponseType.DECLINED) {
            conversationId = null;
        }
    }

    public static ResponsePayload accepted(String invitationId, String responderId, String conversationId,
            long timestamp) {
        return new ResponsePayload(invitationId, responderId, ResponseType.ACCEPTED,
                Objects.requireNonNull(conversationId, "conversationId cannot be null"), timestamp);
    }

    public static ResponsePayload declined(String invitationId, String responderId, long timestamp) {
        return new ResponsePayload(invitationId, responderId, ResponseType.DECLINED, null, timestamp);
    }
}
