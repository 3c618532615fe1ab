package p2pchat.peer.notification;

import p2pchat.common.exception.GatewayException;
import p2pchat.common.model.CancellationPayload;
import p2pchat.common.model.InvitationPayload;
import p2pchat.common.model.ResponsePayload;

/**
 * Push delivery to a peer identity.
 * <p>
 * Each method returns true only when at least one live device of the recipient
 * acknowledged receipt, not when the transport merely accepted the request.
 * A {@link GatewayException} means the call itself failed.
 */
public interface NotificationGateway {

    boolean sendResponse(String recipientPeerId, ResponsePayload payload) throws GatewayException;

    boolean sendInvitation(String recipientPeerId, InvitationPayload payload) throws GatewayException;

    boolean sendCancellation(String recipientPeerId, CancellationPayload payload) throws GatewayException;
}
