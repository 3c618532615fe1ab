package p2pchat.peer.notification;

import java.util.Map;

/**
 * Prints local notifications to standard output.
 */
public class ConsoleNotificationEmitter implements LocalNotificationEmitter {

    @Override
    public void show(String title, String body, String kind, Map<String, Object> data) {
        System.out.println("\n[" + title + "] " + body);
        System.out.print("> ");
    }
}
