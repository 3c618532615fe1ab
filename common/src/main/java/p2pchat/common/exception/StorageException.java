package p2pchat.common.exception;

import java.io.Serial;

/**
 * Thrown when the durable record store cannot read or write a collection.
 */
public class StorageException extends InvitationException {

    @Serial
    private static final long serialVersionUID = 1L;

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
