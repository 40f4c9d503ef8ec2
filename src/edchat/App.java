package edchat;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ========================= APPLICATION ENTRY POINT ===================
 *
 * Starts the chat server:
 *
 *   java -jar edchat.jar [port] [name]
 *
 * HOW THE WHOLE SYSTEM FITS TOGETHER:
 *
 *   App (you are here)
 *    |
 *    |-- ChatServer (sessions, names, rooms)
 *    |-- Reactor (selector loop + ActorThreadPool)
 *         |
 *         |-- for each new client connection:
 *              |
 *              |-- NonBlockingConnectionHandler (manages one client)
 *                   |-- LineMessageEncoderDecoder (bytes <-> lines)
 *                   |-- ChatSession (protocol, from ChatServer.newSession)
 *                        |-- bound to NameSelectionLogic, then to a
 *                            RoomChatLogic
 *
 * Try it with:  telnet localhost 5005
 * =====================================================================
 */
public class App {

    private static final Logger LOG = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        ChatConfig config = ChatConfig.load(args);
        LOG.info("Starting {} with {}", config.getName(), config);

        ChatServer chat = new ChatServer(config.getName());
        Server<String> server = new Reactor<>(
                config.getThreads(),
                config.getPort(),
                chat::newSession,
                LineMessageEncoderDecoder::new);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                server.close();
            } catch (IOException ex) {
                LOG.warn("Failed to close server", ex);
            }
        }, "edchat-shutdown"));

        server.serve();
    }
}
