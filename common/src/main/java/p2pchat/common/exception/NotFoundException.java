package p2pchat.common.exception;

import java.io.Serial;

/**
 * Thrown when a referenced invitation or conversation does not exist locally.
 */
public class NotFoundException extends InvitationException {

    @Serial
    private static final long serialVersionUID = 1L;

    private final String id;

    public NotFoundException(String kind, String id) {
        super(kind + " '" + id + "' not found");
        this.id = id;
    }

    public String getId() {
        return id;
    }
}
