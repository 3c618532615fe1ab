package p2pchat.peer.ui;

import p2pchat.common.exception.InvitationException;
import p2pchat.common.model.Conversation;
import p2pchat.common.model.Invitation;
import p2pchat.common.model.Peer;
import p2pchat.peer.PeerController;
import p2pchat.peer.event.InvitationEventListenerAdapter;
import p2pchat.peer.invitation.InvitationController;
import p2pchat.peer.invitation.SendResult;

import java.util.List;
import java.util.Scanner;

/**
 * Terminal-based user interface for invitations.
 */
public class TerminalUI {

    private final PeerController controller;
    private final InvitationController invitations;

    private boolean running = true;

    public TerminalUI(PeerController controller) {
        this.controller = controller;
        this.invitations = controller.getInvitations();
        InvitationEventListenerAdapter resyncListener = new InvitationEventListenerAdapter() {
            @Override
            public void onResyncRequired(Invitation invitation, String reason) {
                System.out.println("\n[Resync] " + reason + ". Use '/resync " + invitation.id() + " <conversationId>'");
                System.out.print("> ");
            }
        };
        invitations.addEventListener(resyncListener);
    }

    /**
     * Start the terminal UI loop.
     */
    public void start() {
        printHelp();

        try (Scanner scanner = new Scanner(System.in)) {
            while (running && scanner.hasNextLine()) {
                System.out.print("> ");
                String input = scanner.nextLine().trim();

                if (input.isEmpty()) {
                    continue;
                }

                try {
                    processCommand(input);
                } catch (InvitationException | IllegalArgumentException e) {
                    System.out.println("[Error] " + e.getMessage());
                }
            }
        }
    }

    /**
     * Process a user command.
     */
    void processCommand(String input) throws InvitationException {
        String[] parts = input.split("\\s+", 2);
        String command = parts[0].toLowerCase();
        String args = parts.length > 1 ? parts[1].trim() : "";

        switch (command) {
            case "/help" -> printHelp();
            case "/quit" -> running = false;
            case "/peer" -> commandPeer(args);
            case "/invite" -> commandInvite(args);
            case "/accept" -> commandAccept(args);
            case "/decline" -> commandDecline(args);
            case "/cancel" -> commandCancel(args);
            case "/resend" -> commandResend(args);
            case "/resync" -> commandResync(args);
            case "/list" -> commandList();
            default -> System.out.println("Unknown command. Type /help for available commands.");
        }
    }

    private void commandPeer(String args) {
        if (args.isEmpty()) {
            System.out.println("Usage: /peer <id@host:port>");
            return;
        }
        Peer peer = Peer.parse(args);
        controller.addPeer(peer);
        System.out.println("[Peers] Added " + peer);
    }

    private void commandInvite(String args) throws InvitationException {
        String[] parts = args.split("\\s+", 2);
        if (parts[0].isEmpty()) {
            System.out.println("Usage: /invite <peerId> [message]");
            return;
        }
        SendResult result = invitations.sendInvitation(parts[0], parts.length > 1 ? parts[1] : "");
        if (!result.delivered()) {
            System.out.println("[Invitations] " + parts[0] + " could not be reached; use /resend "
                    + result.invitation().id() + " later");
        }
    }

    private void commandAccept(String invitationId) throws InvitationException {
        if (invitationId.isEmpty()) {
            System.out.println("Usage: /accept <invitationId>");
            return;
        }
        Invitation accepted = invitations.accept(invitationId);
        System.out.println("[Invitations] Conversation " + accepted.conversationId() + " is ready");
    }

    private void commandDecline(String invitationId) throws InvitationException {
        if (invitationId.isEmpty()) {
            System.out.println("Usage: /decline <invitationId>");
            return;
        }
        invitations.decline(invitationId);
    }

    private void commandCancel(String invitationId) throws InvitationException {
        if (invitationId.isEmpty()) {
            System.out.println("Usage: /cancel <invitationId>");
            return;
        }
        invitations.cancel(invitationId);
    }

    private void commandResend(String invitationId) throws InvitationException {
        if (invitationId.isEmpty()) {
            System.out.println("Usage: /resend <invitationId>");
            return;
        }
        SendResult result = invitations.resend(invitationId);
        System.out.println("[Invitations] " + result.invitation().id()
                + (result.delivered() ? " delivered" : " still not delivered"));
    }

    private void commandResync(String args) throws InvitationException {
        String[] parts = args.split("\\s+");
        if (parts.length != 2) {
            System.out.println("Usage: /resync <invitationId> <conversationId>");
            return;
        }
        invitations.resynchronize(parts[0], parts[1]);
    }

    private void commandList() throws InvitationException {
        printInvitations("Received", invitations.listReceived());
        printInvitations("Sent", invitations.listSent());

        List<Conversation> conversations = invitations.listConversations();
        System.out.println("\n=== Conversations (" + conversations.size() + ") ===");
        if (conversations.isEmpty()) {
            System.out.println("  (none)");
        }
        for (Conversation conversation : conversations) {
            System.out.println("  # " + conversation.id() + " with " + conversation.participantB());
        }
        System.out.println();
    }

    private void printInvitations(String title, List<Invitation> list) {
        System.out.println("\n=== " + title + " invitations (" + list.size() + ") ===");
        if (list.isEmpty()) {
            System.out.println("  (none)");
        }
        for (Invitation invitation : list) {
            String flag = invitation.resyncRequired() ? " [resync required]" : "";
            System.out.println("  " + invitation.id() + "  " + invitation.senderId() + " -> "
                    + invitation.recipientId() + "  " + invitation.status().wireName() + flag);
        }
    }

    private void printHelp() {
        System.out.println("\nCommands (peer " + controller.getPeerId() + "):");
        System.out.println("  /peer <id@host:port>              Add a known peer address");
        System.out.println("  /invite <peerId> [message]        Send an invitation");
        System.out.println("  /accept <invitationId>            Accept a received invitation");
        System.out.println("  /decline <invitationId>           Decline a received invitation");
        System.out.println("  /cancel <invitationId>            Cancel a sent invitation");
        System.out.println("  /resend <invitationId>            Resend a pending or declined invitation");
        System.out.println("  /resync <invitationId> <chatId>   Attach a conversation id to an accepted invitation");
        System.out.println("  /list                             Show invitations and conversations");
        System.out.println("  /quit                             Exit");
    }
}
