package p2pchat.peer;

import p2pchat.common.model.Peer;
import p2pchat.peer.config.InvitationSettings;
import p2pchat.peer.ui.TerminalUI;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Peer node application for one identity.
 */
public class PeerNode {

    public static void main(String[] args) {
        try {
            CommandLineArgs cmdArgs = parseArguments(args);

            InvitationSettings settings = InvitationSettings.defaults()
                    .withRmiPort(cmdArgs.port)
                    .withDataDirectory(cmdArgs.dataDirectory);
            PeerController controller = new PeerController(cmdArgs.peerId, settings);
            for (Peer peer : cmdArgs.peers) {
                controller.addPeer(peer);
            }
            controller.start();

            // Setup shutdown hook
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                System.out.println("\n[Peer] Shutting down...");
                controller.stop();
            }));

            TerminalUI ui = new TerminalUI(controller);
            ui.start();
            controller.stop();
            System.exit(0);

        } catch (Exception e) {
            System.err.println("[Peer] Fatal error: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    /**
     * Parse command-line arguments.
     */
    static CommandLineArgs parseArguments(String[] args) {
        String peerId = null;
        int port = InvitationSettings.DEFAULT_RMI_PORT;
        Path dataDirectory = InvitationSettings.DEFAULT_DATA_DIRECTORY;
        List<Peer> peers = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--peer-id":
                    if (i + 1 < args.length)
                        peerId = args[++i];
                    break;
                case "--port":
                    if (i + 1 < args.length)
                        port = Integer.parseInt(args[++i]);
                    break;
                case "--data-dir":
                    if (i + 1 < args.length)
                        dataDirectory = Path.of(args[++i]);
                    break;
                case "--peer":
                    if (i + 1 < args.length)
                        peers.add(Peer.parse(args[++i]));
                    break;
                default:
                    System.err.println("Ignoring unknown argument: " + args[i]);
            }
        }

        if (peerId == null) {
            throw new IllegalArgumentException(
                    "Usage: PeerNode --peer-id <id> [--port <port>] [--data-dir <dir>] [--peer <id@host:port>]...");
        }

        return new CommandLineArgs(peerId, port, dataDirectory, peers);
    }

    record CommandLineArgs(String peerId, int port, Path dataDirectory, List<Peer> peers) {
    }
}
