package p2pchat.common.exception;

import java.io.Serial;

/**
 * Thrown when a record is created with an id that is already present.
 * The existing record is never overwritten.
 */
public class DuplicateIdException extends InvitationException {

    @Serial
    private static final long serialVersionUID = 1L;

    private final String id;

    public DuplicateIdException(String kind, String id) {
        super(kind + " '" + id + "' already exists");
        this.id = id;
    }

    public String getId() {
        return id;
    }
}
