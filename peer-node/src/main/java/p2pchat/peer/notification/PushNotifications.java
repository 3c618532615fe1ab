package p2pchat.peer.notification;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import p2pchat.common.model.CancellationPayload;
import p2pchat.common.model.InvitationPayload;
import p2pchat.common.model.PushNotification;
import p2pchat.common.model.ResponsePayload;
import p2pchat.common.model.ResponseType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the push notifications sent for each payload type.
 */
public class PushNotifications {

    private static final TypeReference<LinkedHashMap<String, Object>> DATA_MAP = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public PushNotifications(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public PushNotification response(ResponsePayload payload) {
        boolean accepted = payload.response() == ResponseType.ACCEPTED;
        return new PushNotification(
                accepted ? "Invitation Accepted" : "Invitation Declined",
                payload.responderId() + (accepted ? " accepted your invitation" : " declined your invitation"),
                data(ResponsePayload.TYPE, payload));
    }

    public PushNotification invitation(InvitationPayload payload) {
        return new PushNotification(
                "New Invitation",
                payload.senderId() + " wants to connect with you",
                data(InvitationPayload.TYPE, payload));
    }

    public PushNotification cancellation(CancellationPayload payload) {
        return new PushNotification(
                "Invitation Cancelled",
                payload.senderId() + " cancelled their invitation",
                data(CancellationPayload.TYPE, payload));
    }

    private Map<String, Object> data(String type, Object payload) {
        LinkedHashMap<String, Object> data = new LinkedHashMap<>();
        data.put(PushNotification.TYPE_KEY, type);
        data.putAll(mapper.convertValue(payload, DATA_MAP));
        return data;
    }
}
