package p2pchat.common.exception;

import java.io.Serial;

/**
 * Transport-level failure of a single notification gateway call.
 */
public class GatewayException extends Exception {

    @Serial
    private static final long serialVersionUID = 1L;

    public GatewayException(String message) {
        super(message);
    }

    public GatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
