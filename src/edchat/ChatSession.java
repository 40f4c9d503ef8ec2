package edchat;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ========================= CHAT SESSION ==============================
 *
 * WHAT IS THIS?
 * The chat protocol instance of one client connection. It does not
 * interpret lines itself: every line goes to the {@link ChatLogic} the
 * session is currently bound to. Right after connecting that is the
 * name selection; after a name was chosen it is a chat room.
 *
 * REBINDING
 * rebind(next) moves the session from its current logic to the next:
 *   1. current.onLeave(session)      (if bound)
 *   2. binding := next
 *   3. next.onEnter(session)         (if next != null)
 *      or server.onSessionExit(...)  (if next == null: disconnecting)
 *
 * LOCKING
 * Every event coming from the transport (start, line, close) is handled
 * while holding the ChatServer's monitor, so a line is processed with
 * all its broadcasts before any other session's event.
 * =====================================================================
 */
public class ChatSession implements MessagingProtocol<String> {

    private static final Logger LOG = LoggerFactory.getLogger(ChatSession.class);

    /** Display name of a session that has not chosen one yet. */
    public static final String DEFAULT_NAME = "anonymous";

    private final ChatServer server;

    private ConnectionHandler<String> connection;

    // null once the session is being torn down
    private ChatLogic logic;

    private String name = DEFAULT_NAME;

    ChatSession(ChatServer server) {
        this.server = server;
    }

    @Override
    public void start(ConnectionHandler<String> connection) {
        synchronized (server) {
            this.connection = connection;
            server.onConnect(this);
        }
    }

    @Override
    public void process(String line) {
        synchronized (server) {
            submitLine(line);
        }
    }

    @Override
    public void connectionClosed() {
        synchronized (server) {
            rebind(null);
        }
    }

    /**
     * Hands a complete input line to the bound logic.
     */
    public void submitLine(String line) {
        if (logic == null) {
            LOG.debug("Dropping line of exiting session {}", name);
            return;
        }
        logic.onData(this, line);
    }

    /**
     * Binds this session to {@code next}, or tears it down if {@code next} is
     * null.
     */
    public void rebind(ChatLogic next) {
        if (logic != null) {
            logic.onLeave(this);
        }
        logic = next;
        if (logic != null) {
            logic.onEnter(this);
        } else {
            server.onSessionExit(this);
        }
    }

    /**
     * Sends one line of text to the user.
     */
    public void push(String text) {
        connection.send(text);
    }

    /**
     * Hangs up. The session has left its logic and the server by the time
     * this returns.
     */
    public void disconnect() {
        connection.close();
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    /**
     * @return the logic this session is bound to, null while tearing down
     */
    public ChatLogic getLogic() {
        return logic;
    }

    @Override
    public String toString() {
        return "ChatSession[" + name + "]";
    }
}
