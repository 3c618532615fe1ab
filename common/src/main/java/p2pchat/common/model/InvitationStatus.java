package p2pchat.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle state of an invitation. Serialized in lower case.
 */
public enum InvitationStatus {
    PENDING,
    ACCEPTED,
    DECLINED,
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static InvitationStatus fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        return InvitationStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
