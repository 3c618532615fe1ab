package p2pchat.common.util;

/**
 * Source of identifiers that two devices can agree on without a central allocator.
 */
public interface IdGenerator {

    String newConversationId();

    String newMessageId();

    String newInvitationId();
}
