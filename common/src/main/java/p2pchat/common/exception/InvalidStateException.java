package p2pchat.common.exception;

import p2pchat.common.model.InvitationStatus;

import java.io.Serial;

/**
 * Thrown when an operation is requested against an invitation that is not in the
 * expected state, or by an identity that is not allowed to perform it.
 */
public class InvalidStateException extends InvitationException {

    @Serial
    private static final long serialVersionUID = 1L;

    private final String invitationId;
    private final InvitationStatus currentStatus;

    public InvalidStateException(String invitationId, InvitationStatus currentStatus, String message) {
        super(message);
        this.invitationId = invitationId;
        this.currentStatus = currentStatus;
    }

    public String getInvitationId() {
        return invitationId;
    }

    public InvitationStatus getCurrentStatus() {
        return currentStatus;
    }
}
