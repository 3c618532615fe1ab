package p2pchat.peer.invitation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import p2pchat.common.exception.InvalidStateException;
import p2pchat.common.exception.MalformedPayloadException;
import p2pchat.common.exception.NotFoundException;
import p2pchat.common.model.Conversation;
import p2pchat.common.model.Invitation;
import p2pchat.common.model.InvitationStatus;
import p2pchat.common.model.ResponsePayload;
import p2pchat.common.model.ResponseType;
import p2pchat.peer.event.InvitationEventListenerAdapter;
import p2pchat.peer.util.FakeNotificationGateway;
import p2pchat.peer.util.TestDevice;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for applying a recipient's response on the sender's device.
 */
class SenderAdoptionTest {

    private TestDevice alice;

    @BeforeEach
    void setUp() throws Exception {
        alice = new TestDevice("A", new FakeNotificationGateway());
        alice.invitations.create(Invitation.pending("inv1", "A", "B", "hi", 1_000L));
    }

    @Test
    @DisplayName("Acceptance adopts the carried conversation id verbatim")
    void testLateAdoption() throws Exception {
        Invitation accepted = alice.controller.handleResponse(
                ResponsePayload.accepted("inv1", "B", "chat_xyz", 2_000L));

        assertEquals(InvitationStatus.ACCEPTED, accepted.status());
        assertEquals("chat_xyz", accepted.conversationId());
        assertFalse(accepted.resyncRequired());

        Conversation conversation = alice.conversations.find("chat_xyz").orElseThrow();
        assertEquals("A", conversation.participantA());
        assertEquals("B", conversation.participantB());
        assertEquals(1, alice.controller.getMessages("chat_xyz").size());
        assertEquals(1, alice.emitter.withTitle("Invitation Accepted").size());
    }

    @Test
    @DisplayName("Decline response marks the invitation declined without a conversation")
    void testDeclineResponse() throws Exception {
        Invitation declined = alice.controller.handleResponse(ResponsePayload.declined("inv1", "B", 2_000L));

        assertEquals(InvitationStatus.DECLINED, declined.status());
        assertNull(declined.conversationId());
        assertTrue(alice.controller.listConversations().isEmpty());
        assertEquals(1, alice.emitter.withTitle("Invitation Declined").size());
    }

    @Test
    @DisplayName("Acceptance without a conversation id and no cached id requires a resync")
    void testMissingConversationIdRequiresResync() throws Exception {
        List<String> reasons = new ArrayList<>();
        alice.controller.addEventListener(new InvitationEventListenerAdapter() {
            @Override
            public void onResyncRequired(Invitation invitation, String reason) {
                reasons.add(reason);
            }
        });

        MalformedPayloadException e = assertThrows(MalformedPayloadException.class,
                () -> alice.controller.handleResponse(
                        new ResponsePayload("inv1", "B", ResponseType.ACCEPTED, null, 2_000L)));

        assertEquals("conversationId", e.getField());
        Invitation stored = alice.invitations.get("inv1");
        assertEquals(InvitationStatus.ACCEPTED, stored.status());
        assertTrue(stored.resyncRequired());
        assertNull(stored.conversationId());
        assertEquals(1, reasons.size());
        assertEquals(List.of(stored), alice.controller.listResyncRequired());
        assertTrue(alice.controller.listConversations().isEmpty());
        assertEquals(1, alice.emitter.getShown().size());
        assertEquals("invitation_resync_required", alice.emitter.getShown().get(0).kind());
    }

    @Test
    @DisplayName("Acceptance without a conversation id falls back to the cached id")
    void testMissingConversationIdUsesCache() throws Exception {
        alice.controller.rememberConversationId("inv1", "chat_cached");

        Invitation accepted = alice.controller.handleResponse(
                new ResponsePayload("inv1", "B", ResponseType.ACCEPTED, null, 2_000L));

        assertEquals("chat_cached", accepted.conversationId());
        assertFalse(accepted.resyncRequired());
        assertTrue(alice.conversations.find("chat_cached").isPresent());
    }

    @Test
    @DisplayName("Resynchronize completes an acceptance that lacked its conversation id")
    void testResynchronize() throws Exception {
        assertThrows(MalformedPayloadException.class, () -> alice.controller.handleResponse(
                new ResponsePayload("inv1", "B", ResponseType.ACCEPTED, null, 2_000L)));

        Invitation repaired = alice.controller.resynchronize("inv1", "chat_late");

        assertEquals("chat_late", repaired.conversationId());
        assertFalse(repaired.resyncRequired());
        assertTrue(alice.controller.listResyncRequired().isEmpty());
        assertEquals("chat_late", alice.conversationIdCache.lookup("inv1").orElseThrow());
        assertTrue(alice.controller.findConversationWith("B").isPresent());
    }

    @Test
    @DisplayName("A redelivered acceptance carrying the id repairs a resync")
    void testRedeliveredAcceptanceRepairsResync() throws Exception {
        assertThrows(MalformedPayloadException.class, () -> alice.controller.handleResponse(
                new ResponsePayload("inv1", "B", ResponseType.ACCEPTED, null, 2_000L)));

        Invitation repaired = alice.controller.handleResponse(ResponsePayload.accepted("inv1", "B", "chat_xyz", 2_000L));

        assertEquals("chat_xyz", repaired.conversationId());
        assertFalse(repaired.resyncRequired());
    }

    @Test
    @DisplayName("Resynchronize is refused for an invitation that does not need it")
    void testResynchronizeRefused() {
        assertThrows(InvalidStateException.class, () -> alice.controller.resynchronize("inv1", "chat_xyz"));
    }

    @Test
    @DisplayName("A repeated identical response is acknowledged without side effects")
    void testRepeatedResponseIsNoOp() throws Exception {
        Invitation first = alice.controller.handleResponse(ResponsePayload.accepted("inv1", "B", "chat_xyz", 2_000L));
        alice.emitter.clear();

        Invitation second = alice.controller.handleResponse(ResponsePayload.accepted("inv1", "B", "chat_xyz", 3_000L));

        assertEquals(first, second);
        assertEquals(1, alice.controller.listConversations().size());
        assertEquals(1, alice.controller.getMessages("chat_xyz").size());
        assertTrue(alice.emitter.getShown().isEmpty());
    }

    @Test
    @DisplayName("A conflicting response after a terminal state is rejected")
    void testConflictingResponseRejected() throws Exception {
        alice.controller.handleResponse(ResponsePayload.accepted("inv1", "B", "chat_xyz", 2_000L));

        assertThrows(InvalidStateException.class,
                () -> alice.controller.handleResponse(ResponsePayload.declined("inv1", "B", 3_000L)));
        assertThrows(InvalidStateException.class,
                () -> alice.controller.handleResponse(ResponsePayload.accepted("inv1", "B", "chat_other", 3_000L)));
        assertEquals("chat_xyz", alice.invitations.get("inv1").conversationId());
        assertTrue(alice.conversations.find("chat_other").isEmpty());
    }

    @Test
    @DisplayName("A response from someone other than the recipient is malformed")
    void testResponderMismatch() throws Exception {
        MalformedPayloadException e = assertThrows(MalformedPayloadException.class,
                () -> alice.controller.handleResponse(ResponsePayload.accepted("inv1", "C", "chat_xyz", 2_000L)));

        assertEquals("responderId", e.getField());
        assertTrue(alice.invitations.get("inv1").isPending());
    }

    @Test
    @DisplayName("A late acceptance of a cancelled invitation is rejected")
    void testResponseToCancelledInvitation() throws Exception {
        alice.controller.cancel("inv1");

        assertThrows(InvalidStateException.class,
                () -> alice.controller.handleResponse(ResponsePayload.accepted("inv1", "B", "chat_xyz", 2_000L)));
        assertEquals(InvitationStatus.CANCELLED, alice.invitations.get("inv1").status());
        assertTrue(alice.controller.listConversations().isEmpty());
    }

    @Test
    @DisplayName("A response to an unknown invitation is NotFound")
    void testUnknownInvitation() {
        assertThrows(NotFoundException.class,
                () -> alice.controller.handleResponse(ResponsePayload.declined("nope", "B", 2_000L)));
    }

    @Test
    @DisplayName("A response to an invitation this device received is rejected")
    void testResponseToReceivedInvitation() throws Exception {
        alice.invitations.create(Invitation.pending("inv2", "C", "A", "", 1_000L));

        assertThrows(InvalidStateException.class,
                () -> alice.controller.handleResponse(ResponsePayload.declined("inv2", "A", 2_000L)));
    }
}
