package p2pchat.common.util;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Time-prefixed random identifiers: {@code <prefix>_<epochMillis>-<32 hex chars>}.
 * The random part carries 128 bits from {@link SecureRandom}.
 */
public class RandomIdGenerator implements IdGenerator {

    public static final String CONVERSATION_PREFIX = "chat_";
    public static final String MESSAGE_PREFIX = "msg_";
    public static final String INVITATION_PREFIX = "inv_";

    private static final int RANDOM_BYTES = 16;
    private static final Pattern CONVERSATION_ID = Pattern.compile("chat_\\d+-[0-9a-f]{32}");

    private final SecureRandom random = new SecureRandom();
    private final Clock clock;

    public RandomIdGenerator() {
        this(Clock.systemUTC());
    }

    public RandomIdGenerator(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String newConversationId() {
        return next(CONVERSATION_PREFIX);
    }

    @Override
    public String newMessageId() {
        return next(MESSAGE_PREFIX);
    }

    @Override
    public String newInvitationId() {
        return next(INVITATION_PREFIX);
    }

    /**
     * Whether the value has the shape produced by {@link #newConversationId()}.
     */
    public static boolean isConversationId(String value) {
        return value != null && CONVERSATION_ID.matcher(value).matches();
    }

    private String next(String prefix) {
        byte[] bytes = new byte[RANDOM_BYTES];
        random.nextBytes(bytes);
        return prefix + clock.millis() + "-" + HexFormat.of().formatHex(bytes);
    }
}
