package p2pchat.common.exception;

import java.io.Serial;

/**
 * Thrown when an inbound notification payload lacks the fields its declared type requires.
 */
public class MalformedPayloadException extends InvitationException {

    @Serial
    private static final long serialVersionUID = 1L;

    private final String field;

    public MalformedPayloadException(String field, String message) {
        super(message);
        this.field = field;
    }

    public MalformedPayloadException(String field, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    /**
     * Name of the missing or invalid field, or null when the payload as a whole is unusable.
     */
    public String getField() {
        return field;
    }
}
