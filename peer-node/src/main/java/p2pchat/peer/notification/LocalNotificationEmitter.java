package p2pchat.peer.notification;

import java.util.Map;

/**
 * In-app alerts for the local user. Fire-and-forget.
 */
public interface LocalNotificationEmitter {

    void show(String title, String body, String kind, Map<String, Object> data);
}
