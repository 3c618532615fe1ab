package p2pchat.peer.invitation;

import p2pchat.common.model.Invitation;

/**
 * A newly created invitation and whether the recipient's device confirmed receipt.
 * An undelivered invitation stays pending and can be sent again later.
 */
public record SendResult(Invitation invitation, boolean delivered) {
}
