package p2pchat.peer.util;

import p2pchat.common.exception.GatewayException;
import p2pchat.common.model.CancellationPayload;
import p2pchat.common.model.InvitationPayload;
import p2pchat.common.model.ResponsePayload;
import p2pchat.peer.notification.NotificationGateway;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Scriptable gateway. Each call consumes the next scripted outcome, falling back to the
 * default outcome once the script is exhausted.
 */
public class FakeNotificationGateway implements NotificationGateway {

    public enum Outcome {
        DELIVERED,
        NOT_DELIVERED,
        ERROR
    }

    public record Call(String kind, String recipientPeerId, Object payload) {
    }

    private final Deque<Outcome> script = new ArrayDeque<>();
    private final List<Call> calls = new ArrayList<>();
    private volatile Outcome defaultOutcome = Outcome.DELIVERED;
    private volatile Runnable beforeEachCall = () -> { };

    public synchronized FakeNotificationGateway script(Outcome... outcomes) {
        for (Outcome outcome : outcomes) {
            script.add(outcome);
        }
        return this;
    }

    public FakeNotificationGateway alwaysReturn(Outcome outcome) {
        this.defaultOutcome = outcome;
        return this;
    }

    public FakeNotificationGateway beforeEachCall(Runnable hook) {
        this.beforeEachCall = hook;
        return this;
    }

    @Override
    public boolean sendResponse(String recipientPeerId, ResponsePayload payload) throws GatewayException {
        return record("response", recipientPeerId, payload);
    }

    @Override
    public boolean sendInvitation(String recipientPeerId, InvitationPayload payload) throws GatewayException {
        return record("invitation", recipientPeerId, payload);
    }

    @Override
    public boolean sendCancellation(String recipientPeerId, CancellationPayload payload) throws GatewayException {
        return record("cancellation", recipientPeerId, payload);
    }

    public synchronized List<Call> getCalls() {
        return new ArrayList<>(calls);
    }

    public synchronized List<Call> getCalls(String kind) {
        return calls.stream().filter(call -> call.kind().equals(kind)).toList();
    }

    public ResponsePayload lastResponse() {
        List<Call> responses = getCalls("response");
        return responses.isEmpty() ? null : (ResponsePayload) responses.get(responses.size() - 1).payload();
    }

    private boolean record(String kind, String recipientPeerId, Object payload) throws GatewayException {
        beforeEachCall.run();
        Outcome outcome;
        synchronized (this) {
            calls.add(new Call(kind, recipientPeerId, payload));
            outcome = script.isEmpty() ? defaultOutcome : script.poll();
        }
        if (outcome == Outcome.ERROR) {
            throw new GatewayException("simulated transport failure");
        }
        return outcome == Outcome.DELIVERED;
    }
}
