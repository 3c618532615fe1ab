package p2pchat.peer.invitation;

import p2pchat.common.exception.DuplicateIdException;
import p2pchat.common.exception.InvalidStateException;
import p2pchat.common.exception.MalformedPayloadException;
import p2pchat.common.exception.NotFoundException;
import p2pchat.common.exception.RecipientUnreachableException;
import p2pchat.common.exception.StorageException;
import p2pchat.common.model.CancellationPayload;
import p2pchat.common.model.ChatMessage;
import p2pchat.common.model.Conversation;
import p2pchat.common.model.Invitation;
import p2pchat.common.model.InvitationPayload;
import p2pchat.common.model.InvitationStatus;
import p2pchat.common.model.ResponsePayload;
import p2pchat.common.model.ResponseType;
import p2pchat.common.util.IdGenerator;
import p2pchat.peer.event.InvitationEventListener;
import p2pchat.peer.notification.DeliveryResult;
import p2pchat.peer.notification.DeliveryRetry;
import p2pchat.peer.notification.LocalNotificationEmitter;
import p2pchat.peer.notification.NotificationGateway;
import p2pchat.peer.store.ConversationIdCache;
import p2pchat.peer.store.ConversationStore;
import p2pchat.peer.store.InvitationStore;
import p2pchat.peer.store.MessageStore;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Drives invitations through their lifecycle on one device.
 * <p>
 * Accepting or declining is committed locally first and then gated on confirmed
 * delivery of the response to the sender. If delivery cannot be confirmed the local
 * change is reverted, so the invitation is either fully answered on both sides or
 * still pending here. The conversation id minted on acceptance travels inside the
 * response and is adopted verbatim by the sender's device.
 * <p>
 * All work on one invitation runs under that invitation's lock, from the first read
 * to the end of any compensation. Listener callbacks run after compensation and their
 * failures never reach the caller.
 */
public class InvitationController {

    private static final String TAG = "[Invitations] ";

    private final String localPeerId;
    private final InvitationStore invitations;
    private final ConversationStore conversations;
    private final MessageStore messages;
    private final ConversationIdCache conversationIdCache;
    private final NotificationGateway gateway;
    private final LocalNotificationEmitter emitter;
    private final IdGenerator ids;
    private final DeliveryRetry retry;
    private final Clock clock;

    private final KeyedLocks locks = new KeyedLocks();
    private final List<InvitationEventListener> listeners = new CopyOnWriteArrayList<>();

    public InvitationController(String localPeerId, InvitationStore invitations, ConversationStore conversations,
            MessageStore messages, ConversationIdCache conversationIdCache, NotificationGateway gateway,
            LocalNotificationEmitter emitter, IdGenerator ids, DeliveryRetry retry) {
        this(localPeerId, invitations, conversations, messages, conversationIdCache, gateway, emitter, ids, retry,
                Clock.systemUTC());
    }

    public InvitationController(String localPeerId, InvitationStore invitations, ConversationStore conversations,
            MessageStore messages, ConversationIdCache conversationIdCache, NotificationGateway gateway,
            LocalNotificationEmitter emitter, IdGenerator ids, DeliveryRetry retry, Clock clock) {
        this.localPeerId = Objects.requireNonNull(localPeerId, "localPeerId cannot be null");
        this.invitations = Objects.requireNonNull(invitations);
        this.conversations = Objects.requireNonNull(conversations);
        this.messages = Objects.requireNonNull(messages);
        this.conversationIdCache = Objects.requireNonNull(conversationIdCache);
        this.gateway = Objects.requireNonNull(gateway);
        this.emitter = Objects.requireNonNull(emitter);
        this.ids = Objects.requireNonNull(ids);
        this.retry = Objects.requireNonNull(retry);
        this.clock = Objects.requireNonNull(clock);
    }

    public String getLocalPeerId() {
        return localPeerId;
    }

    public void addEventListener(InvitationEventListener listener) {
        listeners.add(listener);
    }

    public void removeEventListener(InvitationEventListener listener) {
        listeners.remove(listener);
    }

    // ---------------------------------------------------------------- sender side

    /**
     * Create a pending invitation and deliver it to the recipient.
     * Delivery failure does not undo the invitation; see {@link #resend(String)}.
     */
    public SendResult sendInvitation(String recipientId, String message)
            throws InvalidStateException, DuplicateIdException, StorageException {
        Objects.requireNonNull(recipientId, "recipientId cannot be null");
        if (recipientId.equals(localPeerId)) {
            throw new IllegalArgumentException("Cannot invite yourself");
        }

        try (KeyedLocks.Held recipientLock = locks.acquire("to:" + recipientId)) {
            Optional<Invitation> outstanding = invitations.listBySender(localPeerId)
                    .filter(inv -> inv.recipientId().equals(recipientId) && inv.isPending())
                    .findFirst();
            if (outstanding.isPresent()) {
                throw new InvalidStateException(outstanding.get().id(), InvitationStatus.PENDING,
                        "Invitation to " + recipientId + " already sent");
            }

            Invitation invitation = Invitation.pending(ids.newInvitationId(), localPeerId, recipientId, message,
                    clock.millis());
            // Cancel and resend wait on this lock until delivery has finished.
            try (KeyedLocks.Held invitationLock = locks.acquire(invitation.id())) {
                invitations.create(invitation);
                notifyLog("Invitation " + invitation.id() + " created for " + recipientId);

                boolean delivered = deliverInvitation(invitation);
                emit("Invitation Sent", "Invitation sent to " + recipientId, "invitation_sent",
                        data("invitationId", invitation.id(), "recipientId", recipientId));
                return new SendResult(invitation, delivered);
            }
        }
    }

    /**
     * Send an invitation again. A pending invitation is redelivered as is; a declined one
     * is replaced by a fresh pending invitation to the same recipient, the declined record
     * being kept for history.
     */
    public SendResult resend(String invitationId)
            throws NotFoundException, InvalidStateException, DuplicateIdException, StorageException {
        Invitation declined;
        try (KeyedLocks.Held held = locks.acquire(invitationId)) {
            Invitation invitation = invitations.get(invitationId);
            if (!invitation.isSentBy(localPeerId)) {
                throw new InvalidStateException(invitationId, invitation.status(),
                        "Only the sender can resend invitation " + invitationId);
            }
            if (invitation.isPending()) {
                return new SendResult(invitation, deliverInvitation(invitation));
            }
            if (invitation.status() != InvitationStatus.DECLINED) {
                throw new InvalidStateException(invitationId, invitation.status(),
                        "Only pending or declined invitations can be resent");
            }
            declined = invitation;
        }
        return sendInvitation(declined.recipientId(), declined.message());
    }

    /**
     * Withdraw a pending invitation. Always commits locally; the recipient is told on a
     * best-effort basis.
     */
    public Invitation cancel(String invitationId) throws NotFoundException, InvalidStateException, StorageException {
        try (KeyedLocks.Held held = locks.acquire(invitationId)) {
            Invitation original = invitations.get(invitationId);
            if (!original.isSentBy(localPeerId)) {
                throw new InvalidStateException(invitationId, original.status(),
                        "Only the sender can cancel invitation " + invitationId);
            }
            if (!original.isPending()) {
                throw new InvalidStateException(invitationId, original.status(),
                        "Invitation " + invitationId + " is not pending");
            }

            long now = clock.millis();
            Invitation cancelled = original.cancel(now);
            invitations.update(cancelled);
            notifyUpdated(cancelled);
            notifyLog("Cancelled invitation " + invitationId);
            emit("Invitation Cancelled", "Invitation to " + original.recipientId() + " has been cancelled",
                    "invitation_cancelled", data("invitationId", invitationId, "recipientId", original.recipientId()));

            CancellationPayload payload = new CancellationPayload(invitationId, localPeerId, now);
            DeliveryResult result = retry.deliverOnce("cancellation of " + invitationId,
                    () -> gateway.sendCancellation(original.recipientId(), payload));
            if (!result.delivered()) {
                notifyLog("Could not tell " + original.recipientId() + " about the cancellation of " + invitationId);
            }
            return cancelled;
        }
    }

    /**
     * Apply a response that arrived from the recipient's device.
     * An acceptance adopts the carried conversation id verbatim. If the id is missing and
     * no cached copy exists, the invitation is marked accepted with {@code resyncRequired}
     * and a {@link MalformedPayloadException} reports the condition.
     */
    public Invitation handleResponse(ResponsePayload payload) throws NotFoundException, InvalidStateException,
            MalformedPayloadException, DuplicateIdException, StorageException {
        if (payload.conversationId() != null) {
            conversationIdCache.remember(payload.invitationId(), payload.conversationId());
        }

        try (KeyedLocks.Held held = locks.acquire(payload.invitationId())) {
            Invitation invitation = invitations.get(payload.invitationId());
            if (!invitation.isSentBy(localPeerId)) {
                throw new InvalidStateException(invitation.id(), invitation.status(),
                        "Invitation " + invitation.id() + " was not sent from this device");
            }
            if (!invitation.recipientId().equals(payload.responderId())) {
                throw new MalformedPayloadException("responderId", "Response to " + invitation.id()
                        + " came from " + payload.responderId() + " instead of " + invitation.recipientId());
            }

            if (invitation.status().isTerminal()) {
                return handleRepeatedResponse(invitation, payload);
            }
            if (payload.response() == ResponseType.DECLINED) {
                Invitation declined = invitation.decline(clock.millis());
                invitations.update(declined);
                notifyUpdated(declined);
                notifyLog(payload.responderId() + " declined invitation " + invitation.id());
                emit("Invitation Declined", payload.responderId() + " declined your invitation",
                        "invitation_declined", data("invitationId", invitation.id(),
                                "responderId", payload.responderId()));
                return declined;
            }

            String conversationId = payload.conversationId() != null
                    ? payload.conversationId()
                    : conversationIdCache.lookup(invitation.id()).orElse(null);
            if (conversationId == null) {
                return markResyncRequired(invitation);
            }
            return adopt(invitation, conversationId);
        }
    }

    /**
     * Complete an acceptance that arrived without a conversation id, once the id has been
     * obtained some other way.
     */
    public Invitation resynchronize(String invitationId, String conversationId)
            throws NotFoundException, InvalidStateException, DuplicateIdException, StorageException {
        Objects.requireNonNull(conversationId, "conversationId cannot be null");
        try (KeyedLocks.Held held = locks.acquire(invitationId)) {
            Invitation invitation = invitations.get(invitationId);
            if (!invitation.isSentBy(localPeerId) || !invitation.resyncRequired()) {
                throw new InvalidStateException(invitationId, invitation.status(),
                        "Invitation " + invitationId + " does not need a resync");
            }
            conversationIdCache.remember(invitationId, conversationId);
            return adopt(invitation, conversationId);
        }
    }

    /**
     * Record a conversation id learned for an invitation outside the push path.
     */
    public void rememberConversationId(String invitationId, String conversationId) throws StorageException {
        conversationIdCache.remember(invitationId, conversationId);
    }

    // ---------------------------------------------------------------- recipient side

    /**
     * Store an invitation delivered from the sender's device. Repeated deliveries of the
     * same invitation are ignored.
     */
    public Invitation handleInvitationReceived(InvitationPayload payload)
            throws MalformedPayloadException, StorageException, DuplicateIdException {
        if (!payload.recipientId().equals(localPeerId)) {
            throw new MalformedPayloadException("recipientId",
                    "Invitation " + payload.invitationId() + " is addressed to " + payload.recipientId());
        }
        if (payload.senderId().equals(localPeerId)) {
            throw new MalformedPayloadException("senderId",
                    "Invitation " + payload.invitationId() + " claims to come from this device");
        }

        try (KeyedLocks.Held held = locks.acquire(payload.invitationId())) {
            Optional<Invitation> existing = invitations.find(payload.invitationId());
            if (existing.isPresent()) {
                notifyLog("Ignoring repeated delivery of invitation " + payload.invitationId());
                return existing.get();
            }

            Invitation invitation = Invitation.pending(payload.invitationId(), payload.senderId(),
                    payload.recipientId(), payload.message(), payload.createdAt());
            invitations.create(invitation);
            fire(listener -> listener.onInvitationReceived(invitation));
            notifyLog("Invitation " + invitation.id() + " received from " + invitation.senderId());
            emit("New Invitation", invitation.senderId() + " wants to connect with you", "invitation_received",
                    data("invitationId", invitation.id(), "senderId", invitation.senderId()));
            return invitation;
        }
    }

    /**
     * Accept an invitation addressed to this device and provision its conversation.
     *
     * @throws RecipientUnreachableException if the sender's device never confirmed the
     *                                       response; the invitation is pending again
     */
    public Invitation accept(String invitationId) throws NotFoundException, InvalidStateException,
            RecipientUnreachableException, DuplicateIdException, StorageException {
        try (KeyedLocks.Held held = locks.acquire(invitationId)) {
            Invitation original = invitations.get(invitationId);
            requireRespondable(original);

            long now = clock.millis();
            String conversationId = ids.newConversationId();
            Conversation conversation = openConversation(conversationId, original.senderId(), now);

            Invitation accepted = original.accept(conversationId, now);
            try {
                invitations.update(accepted);
            } catch (NotFoundException | StorageException | RuntimeException e) {
                discardAfterFailure(conversation, e);
                throw e;
            }

            ResponsePayload payload = ResponsePayload.accepted(invitationId, localPeerId, conversationId, now);
            DeliveryResult result = retry.deliver("acceptance of " + invitationId,
                    () -> gateway.sendResponse(original.senderId(), payload));
            if (!result.delivered()) {
                compensate(original, accepted, conversation);
                notifyUpdated(original);
                notifyLog("Acceptance of " + invitationId + " rolled back: " + original.senderId()
                        + " unreachable after " + result.attempts() + " attempt(s)");
                throw new RecipientUnreachableException(original.senderId(), result.attempts());
            }

            fire(listener -> listener.onConversationOpened(conversation));
            notifyUpdated(accepted);
            notifyLog("Accepted invitation " + invitationId + " from " + original.senderId()
                    + ", conversation " + conversationId);
            emit("Invitation Accepted", "You accepted the invitation from " + original.senderId(),
                    "invitation_accepted", data("invitationId", invitationId, "senderId", original.senderId(),
                            "conversationId", conversationId));
            return accepted;
        }
    }

    /**
     * Decline an invitation addressed to this device.
     *
     * @throws RecipientUnreachableException if the sender's device never confirmed the
     *                                       response; the invitation is pending again
     */
    public Invitation decline(String invitationId) throws NotFoundException, InvalidStateException,
            RecipientUnreachableException, StorageException {
        try (KeyedLocks.Held held = locks.acquire(invitationId)) {
            Invitation original = invitations.get(invitationId);
            requireRespondable(original);

            long now = clock.millis();
            Invitation declined = original.decline(now);
            invitations.update(declined);

            ResponsePayload payload = ResponsePayload.declined(invitationId, localPeerId, now);
            DeliveryResult result = retry.deliver("decline of " + invitationId,
                    () -> gateway.sendResponse(original.senderId(), payload));
            if (!result.delivered()) {
                compensate(original, declined, null);
                notifyUpdated(original);
                notifyLog("Decline of " + invitationId + " rolled back: " + original.senderId()
                        + " unreachable after " + result.attempts() + " attempt(s)");
                throw new RecipientUnreachableException(original.senderId(), result.attempts());
            }

            notifyUpdated(declined);
            notifyLog("Declined invitation " + invitationId + " from " + original.senderId());
            emit("Invitation Declined", "You declined the invitation from " + original.senderId(),
                    "invitation_declined", data("invitationId", invitationId, "senderId", original.senderId()));
            return declined;
        }
    }

    /**
     * Apply the sender's withdrawal of an invitation. A cancellation that arrives after
     * this device already answered is ignored.
     */
    public Invitation handleCancellation(CancellationPayload payload)
            throws NotFoundException, MalformedPayloadException, StorageException {
        try (KeyedLocks.Held held = locks.acquire(payload.invitationId())) {
            Invitation invitation = invitations.get(payload.invitationId());
            if (!invitation.senderId().equals(payload.senderId()) || !invitation.isAddressedTo(localPeerId)) {
                throw new MalformedPayloadException("senderId", "Cancellation of " + invitation.id()
                        + " does not match its sender " + invitation.senderId());
            }
            if (!invitation.isPending()) {
                notifyLog("Ignoring cancellation of " + invitation.id() + " already " + invitation.status().wireName());
                return invitation;
            }

            Invitation cancelled = invitation.cancel(clock.millis());
            invitations.update(cancelled);
            notifyUpdated(cancelled);
            notifyLog(invitation.senderId() + " cancelled invitation " + invitation.id());
            emit("Invitation Cancelled", invitation.senderId() + " cancelled their invitation",
                    "invitation_cancelled", data("invitationId", invitation.id(), "senderId", invitation.senderId()));
            return cancelled;
        }
    }

    // ---------------------------------------------------------------- queries

    public Invitation getInvitation(String invitationId) throws NotFoundException, StorageException {
        return invitations.get(invitationId);
    }

    public List<Invitation> listSent() throws StorageException {
        return invitations.listBySender(localPeerId).collect(Collectors.toList());
    }

    public List<Invitation> listReceived() throws StorageException {
        return invitations.listByRecipient(localPeerId).collect(Collectors.toList());
    }

    public List<Invitation> listPendingReceived() throws StorageException {
        return invitations.listByRecipient(localPeerId).filter(Invitation::isPending).collect(Collectors.toList());
    }

    public List<Invitation> listResyncRequired() throws StorageException {
        return invitations.listBySender(localPeerId).filter(Invitation::resyncRequired).collect(Collectors.toList());
    }

    public Optional<Conversation> findConversationWith(String peerId) throws StorageException {
        return conversations.findByParticipants(localPeerId, peerId);
    }

    public Optional<Conversation> getConversation(String conversationId) throws StorageException {
        return conversations.find(conversationId);
    }

    public List<Conversation> listConversations() throws StorageException {
        return conversations.listFor(localPeerId);
    }

    public List<ChatMessage> getMessages(String conversationId) throws StorageException {
        return messages.listByConversation(conversationId);
    }

    // ---------------------------------------------------------------- internals

    private void requireRespondable(Invitation invitation) throws InvalidStateException {
        if (!invitation.isAddressedTo(localPeerId)) {
            throw new InvalidStateException(invitation.id(), invitation.status(),
                    "Invitation " + invitation.id() + " is not addressed to " + localPeerId);
        }
        if (!invitation.isPending()) {
            throw new InvalidStateException(invitation.id(), invitation.status(),
                    "Invitation " + invitation.id() + " is not pending");
        }
    }

    private boolean deliverInvitation(Invitation invitation) {
        InvitationPayload payload = InvitationPayload.of(invitation);
        DeliveryResult result = retry.deliver("invitation " + invitation.id(),
                () -> gateway.sendInvitation(invitation.recipientId(), payload));
        if (!result.delivered()) {
            notifyLog("Invitation " + invitation.id() + " not delivered to " + invitation.recipientId()
                    + " yet; it stays pending");
        }
        return result.delivered();
    }

    /**
     * Seed message first, then the conversation, so no conversation ever exists without it.
     */
    private Conversation openConversation(String conversationId, String remotePeerId, long now)
            throws DuplicateIdException, StorageException {
        ChatMessage seed = ChatMessage.seed(ids.newMessageId(), conversationId, remotePeerId, now);
        messages.append(seed);
        Conversation conversation = Conversation.open(conversationId, localPeerId, remotePeerId, seed.id(), now);
        try {
            conversations.create(conversation);
        } catch (DuplicateIdException | StorageException e) {
            messages.delete(seed.id());
            throw e;
        }
        return conversation;
    }

    private void discardConversation(Conversation conversation) throws StorageException {
        conversations.delete(conversation.id());
        messages.deleteByConversation(conversation.id());
    }

    /**
     * Remove a conversation provisioned by an operation that is failing with {@code cause}.
     * A failure here is attached to the cause instead of replacing it.
     */
    private void discardAfterFailure(Conversation conversation, Exception cause) {
        try {
            discardConversation(conversation);
        } catch (StorageException | RuntimeException e) {
            cause.addSuppressed(e);
            notifyError("Removal of conversation " + conversation.id() + " failed", e);
        }
    }

    /**
     * Undo an optimistic response: put back the exact record read before the write and
     * drop the conversation it provisioned, if any. Both steps always run. If either
     * fails, the thrown exception names the state each record was left in.
     */
    private void compensate(Invitation original, Invitation attempted, Conversation provisioned)
            throws StorageException {
        StorageException failure = null;
        try {
            invitations.update(original);
        } catch (NotFoundException | StorageException | RuntimeException e) {
            failure = new StorageException("Rollback of invitation " + original.id() + " failed; it may still read "
                    + attempted.status().wireName() + " instead of " + original.status().wireName(), e);
        }
        if (provisioned != null) {
            try {
                discardConversation(provisioned);
            } catch (StorageException | RuntimeException e) {
                StorageException discardFailure = new StorageException("Rollback of invitation " + original.id()
                        + " left conversation " + provisioned.id() + " in place", e);
                if (failure == null) {
                    failure = discardFailure;
                } else {
                    failure.addSuppressed(discardFailure);
                }
            }
        }
        if (failure != null) {
            notifyError(failure.getMessage(), failure);
            throw failure;
        }
    }

    private Invitation adopt(Invitation invitation, String conversationId)
            throws DuplicateIdException, StorageException, NotFoundException {
        long now = clock.millis();
        Optional<Conversation> existing = conversations.find(conversationId);
        Conversation conversation;
        boolean created = false;
        if (existing.isPresent()) {
            if (!existing.get().isBetween(localPeerId, invitation.recipientId())) {
                throw new DuplicateIdException("Conversation", conversationId);
            }
            conversation = existing.get();
        } else {
            conversation = openConversation(conversationId, invitation.recipientId(), now);
            created = true;
        }

        Invitation accepted = invitation.accept(conversationId, now);
        try {
            invitations.update(accepted);
        } catch (NotFoundException | StorageException | RuntimeException e) {
            if (created) {
                discardAfterFailure(conversation, e);
            }
            throw e;
        }

        if (created) {
            fire(listener -> listener.onConversationOpened(conversation));
        }
        notifyUpdated(accepted);
        notifyLog(invitation.recipientId() + " accepted invitation " + invitation.id()
                + ", conversation " + conversationId);
        emit("Invitation Accepted", invitation.recipientId() + " accepted your invitation", "invitation_accepted",
                data("invitationId", invitation.id(), "responderId", invitation.recipientId(),
                        "conversationId", conversationId));
        return accepted;
    }

    private Invitation markResyncRequired(Invitation invitation)
            throws StorageException, NotFoundException, MalformedPayloadException {
        Invitation flagged = invitation.acceptAwaitingResync(clock.millis());
        invitations.update(flagged);
        notifyUpdated(flagged);
        String reason = "Acceptance of " + invitation.id() + " arrived without a conversation id";
        fire(listener -> listener.onResyncRequired(flagged, reason));
        emit("Invitation Accepted", invitation.recipientId()
                        + " accepted your invitation, but the conversation could not be opened",
                "invitation_resync_required", data("invitationId", invitation.id(),
                        "responderId", invitation.recipientId()));
        throw new MalformedPayloadException("conversationId", reason + "; resync required");
    }

    /**
     * A response for an invitation that is already terminal here. Redeliveries of the
     * outcome already applied are acknowledged; anything else is a conflict.
     */
    private Invitation handleRepeatedResponse(Invitation invitation, ResponsePayload payload)
            throws InvalidStateException, DuplicateIdException, StorageException, NotFoundException {
        if (invitation.status() == InvitationStatus.DECLINED && payload.response() == ResponseType.DECLINED) {
            notifyLog("Ignoring repeated decline of " + invitation.id());
            return invitation;
        }
        if (invitation.status() == InvitationStatus.ACCEPTED && payload.response() == ResponseType.ACCEPTED) {
            if (invitation.resyncRequired() && payload.conversationId() != null) {
                return adopt(invitation, payload.conversationId());
            }
            if (payload.conversationId() == null || payload.conversationId().equals(invitation.conversationId())) {
                notifyLog("Ignoring repeated acceptance of " + invitation.id());
                return invitation;
            }
        }
        throw new InvalidStateException(invitation.id(), invitation.status(), "Invitation " + invitation.id()
                + " is already " + invitation.status().wireName() + "; response '"
                + payload.response().wireName() + "' rejected");
    }

    private void emit(String title, String body, String kind, Map<String, Object> data) {
        try {
            emitter.show(title, body, kind, data);
        } catch (RuntimeException e) {
            System.err.println(TAG + "Local notification '" + title + "' failed: " + e.getMessage());
        }
    }

    private static Map<String, Object> data(String... keyValues) {
        Map<String, Object> data = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            data.put(keyValues[i], keyValues[i + 1]);
        }
        return data;
    }

    private void fire(Consumer<InvitationEventListener> event) {
        for (InvitationEventListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                System.err.println(TAG + "Listener " + listener.getClass().getName() + " failed: " + e.getMessage());
            }
        }
    }

    private void notifyUpdated(Invitation invitation) {
        fire(listener -> listener.onInvitationUpdated(invitation));
    }

    private void notifyLog(String message) {
        System.out.println(TAG + message);
        fire(listener -> listener.onLog(message));
    }

    private void notifyError(String message, Throwable t) {
        System.err.println(TAG + message + ": " + t.getMessage());
        fire(listener -> listener.onError(message, t));
    }
}
