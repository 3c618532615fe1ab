package p2pchat.peer.notification;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import p2pchat.common.exception.InvalidStateException;
import p2pchat.common.exception.MalformedPayloadException;
import p2pchat.common.model.Invitation;
import p2pchat.common.model.InvitationPayload;
import p2pchat.common.model.InvitationStatus;
import p2pchat.common.model.ResponsePayload;
import p2pchat.common.model.ResponseType;
import p2pchat.peer.event.InvitationEventListenerAdapter;
import p2pchat.peer.util.FakeNotificationGateway;
import p2pchat.peer.util.TestDevice;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InboundNotificationDispatcherTest {

    private TestDevice alice;
    private InboundNotificationDispatcher dispatcher;
    private PushNotifications notifications;
    private final List<Throwable> errors = new ArrayList<>();

    @BeforeEach
    void setUp() throws Exception {
        alice = new TestDevice("A", new FakeNotificationGateway());
        alice.invitations.create(Invitation.pending("inv1", "A", "B", "hi", 1_000L));
        dispatcher = new InboundNotificationDispatcher(alice.controller, new NotificationPayloadParser(alice.mapper));
        dispatcher.addEventListener(new InvitationEventListenerAdapter() {
            @Override
            public void onError(String message, Throwable t) {
                errors.add(t);
            }
        });
        notifications = new PushNotifications(alice.mapper);
    }

    @Test
    @DisplayName("An acceptance notification is applied on the sender")
    void testDispatchAcceptance() throws Exception {
        boolean applied = dispatcher.dispatch(
                notifications.response(ResponsePayload.accepted("inv1", "B", "chat_xyz", 2_000L)).getData());

        assertTrue(applied);
        assertEquals("chat_xyz", alice.invitations.get("inv1").conversationId());
        assertTrue(errors.isEmpty());
    }

    @Test
    @DisplayName("An invitation notification is stored on the recipient")
    void testDispatchInvitation() throws Exception {
        assertTrue(dispatcher.dispatch(
                notifications.invitation(new InvitationPayload("inv2", "C", "A", "yo", 3_000L)).getData()));

        assertEquals(1, alice.controller.listPendingReceived().size());
    }

    @Test
    @DisplayName("An acceptance without a conversation id is reported, never dropped silently")
    void testMissingConversationIdReported() throws Exception {
        Map<String, Object> data = new HashMap<>(notifications.response(
                new ResponsePayload("inv1", "B", ResponseType.ACCEPTED, null, 2_000L)).getData());

        assertFalse(dispatcher.dispatch(data));

        assertEquals(1, errors.size());
        assertInstanceOf(MalformedPayloadException.class, errors.get(0));
        Invitation stored = alice.invitations.get("inv1");
        assertEquals(InvitationStatus.ACCEPTED, stored.status());
        assertTrue(stored.resyncRequired());
    }

    @Test
    @DisplayName("A rejected transition is reported and not acknowledged")
    void testRejectedTransitionReported() throws Exception {
        alice.controller.cancel("inv1");

        assertFalse(dispatcher.dispatch(
                notifications.response(ResponsePayload.accepted("inv1", "B", "chat_xyz", 2_000L)).getData()));

        assertEquals(1, errors.size());
        assertInstanceOf(InvalidStateException.class, errors.get(0));
    }

    @Test
    @DisplayName("Unknown types and empty data are not acknowledged")
    void testUnknownAndEmpty() {
        assertFalse(dispatcher.dispatch(Map.of("type", "chat_message")));
        assertFalse(dispatcher.dispatch(Map.of()));
        assertEquals(1, errors.size());
    }
}
