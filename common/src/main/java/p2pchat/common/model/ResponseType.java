package p2pchat.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Recipient's answer to an invitation as carried in a {@link ResponsePayload}.
 */
public enum ResponseType {
    ACCEPTED,
    DECLINED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ResponseType fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("response cannot be null");
        }
        return ResponseType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
