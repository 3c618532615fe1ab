package p2pchat.peer.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import p2pchat.common.util.IdGenerator;
import p2pchat.common.util.RandomIdGenerator;
import p2pchat.peer.config.InvitationSettings;
import p2pchat.peer.invitation.InvitationController;
import p2pchat.peer.notification.DeliveryRetry;
import p2pchat.peer.notification.NotificationGateway;
import p2pchat.peer.store.ConversationIdCache;
import p2pchat.peer.store.ConversationStore;
import p2pchat.peer.store.InMemoryRecordStore;
import p2pchat.peer.store.InvitationStore;
import p2pchat.peer.store.JsonSupport;
import p2pchat.peer.store.MessageStore;
import p2pchat.peer.store.RecordStore;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * One simulated device: in-memory stores, a controller, and a retry helper that records
 * its waits instead of sleeping.
 */
public class TestDevice {

    public final String peerId;
    public final RecordStore records;
    public final ObjectMapper mapper = JsonSupport.newObjectMapper();
    public final InvitationStore invitations;
    public final ConversationStore conversations;
    public final MessageStore messages;
    public final ConversationIdCache conversationIdCache;
    public final RecordingNotificationEmitter emitter = new RecordingNotificationEmitter();
    public final List<Duration> sleeps = new ArrayList<>();
    public final InvitationController controller;

    public TestDevice(String peerId, NotificationGateway gateway) {
        this(peerId, gateway, new RandomIdGenerator());
    }

    public TestDevice(String peerId, NotificationGateway gateway, IdGenerator ids) {
        this(peerId, gateway, ids, new InMemoryRecordStore());
    }

    public TestDevice(String peerId, NotificationGateway gateway, IdGenerator ids, RecordStore records) {
        this.peerId = peerId;
        this.records = records;
        this.invitations = new InvitationStore(records, mapper);
        this.conversations = new ConversationStore(records, mapper);
        this.messages = new MessageStore(records, mapper);
        this.conversationIdCache = new ConversationIdCache(records);
        InvitationSettings settings = InvitationSettings.defaults();
        DeliveryRetry retry = new DeliveryRetry(settings, duration -> {
            synchronized (sleeps) {
                sleeps.add(duration);
            }
        });
        this.controller = new InvitationController(peerId, invitations, conversations, messages,
                conversationIdCache, gateway, emitter, ids, retry);
    }
}
