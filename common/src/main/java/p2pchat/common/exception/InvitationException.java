package p2pchat.common.exception;

import java.io.Serial;

/**
 * Base type for failures of invitation and conversation operations.
 */
public abstract class InvitationException extends Exception {

    @Serial
    private static final long serialVersionUID = 1L;

    protected InvitationException(String message) {
        super(message);
    }

    protected InvitationException(String message, Throwable cause) {
        super(message, cause);
    }
}
