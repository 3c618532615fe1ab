package p2pchat.common.model;

import java.io.Serial;
import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * What travels over the push transport: a display title and body plus a flat data map.
 * The data map carries a {@code type} key and the payload fields.
 */
public final class PushNotification implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    public static final String TYPE_KEY = "type";

    private final String title;
    private final String body;
    private final LinkedHashMap<String, Object> data;

    public PushNotification(String title, String body, Map<String, Object> data) {
        this.title = Objects.requireNonNull(title);
        this.body = Objects.requireNonNull(body);
        this.data = new LinkedHashMap<>(Objects.requireNonNull(data));
    }

    public String getTitle() {
        return title;
    }

    public String getBody() {
        return body;
    }

    public Map<String, Object> getData() {
        return Collections.unmodifiableMap(data);
    }

    public String getType() {
        Object type = data.get(TYPE_KEY);
        return type != null ? type.toString() : null;
    }

    @Override
    public String toString() {
        return String.format("PushNotification{type='%s', title='%s'}", getType(), title);
    }
}
