package edchat;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ========================== CHAT SERVER ==============================
 *
 * WHAT IS THIS?
 * The chat application behind the Reactor. It owns:
 *   - every live ChatSession (rooms only point at their members)
 *   - the NameDirectory of names in use
 *   - the RoomRegistry with the hall and the user rooms
 *   - the NameSelectionLogic shared by all new sessions
 *
 * Pass newSession as the Reactor's protocol factory:
 *
 *   ChatServer chat = new ChatServer("EdChat");
 *   new Reactor<>(4, 5005, chat::newSession, LineMessageEncoderDecoder::new).serve();
 *
 * THREAD SAFETY
 * The server object is the one lock of the chat: sessions hold it
 * while handling an event, and the room and session operations below
 * are synchronized on it.
 * =====================================================================
 */
public class ChatServer {

    private static final Logger LOG = LoggerFactory.getLogger(ChatServer.class);

    // same layout as C's ctime(), e.g. "Mon Oct  5 20:31:07 2026"
    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("EEE MMM ppd HH:mm:ss yyyy", Locale.US);

    private final String serviceName;

    private final Clock clock;

    private final Set<ChatSession> sessions = new LinkedHashSet<>();

    private final NameDirectory names = new NameDirectory();

    private final RoomRegistry rooms;

    private final NameSelectionLogic nameSelection;

    public ChatServer(String serviceName) {
        this(serviceName, Clock.systemDefaultZone());
    }

    /**
     * @param serviceName names the hall and appears in the welcome banner
     * @param clock       source of the message timestamps
     */
    public ChatServer(String serviceName, Clock clock) {
        this.serviceName = serviceName;
        this.clock = clock;
        this.rooms = new RoomRegistry(this, serviceName + " Hall");
        this.nameSelection = new NameSelectionLogic(serviceName, rooms.getHall(), names);
    }

    /**
     * Protocol factory for the Reactor: one fresh session per connection.
     */
    public ChatSession newSession() {
        return new ChatSession(this);
    }

    public String getServiceName() {
        return serviceName;
    }

    // --- session lifecycle ---

    synchronized void onConnect(ChatSession session) {
        sessions.add(session);
        LOG.debug("Session connected, {} online", sessions.size());
        session.rebind(nameSelection);
    }

    synchronized void onSessionExit(ChatSession session) {
        if (!sessions.remove(session)) {
            return;
        }
        nameSelection.release(session);
        LOG.info("User \"{}\" quit, {} online", session.getName(), sessions.size());
    }

    public synchronized int sessionCount() {
        return sessions.size();
    }

    public synchronized boolean isNameInUse(String name) {
        return names.contains(name);
    }

    // --- rooms ---

    public RoomChatLogic getHall() {
        return rooms.getHall();
    }

    /**
     * Creates the room unless it exists.
     */
    public synchronized void addRoom(String roomName) {
        if (rooms.create(roomName)) {
            LOG.info("Room \"{}\" created", roomName);
        }
    }

    public synchronized RoomChatLogic getRoom(String roomName) throws RoomNotFoundException {
        return rooms.lookup(roomName);
    }

    public synchronized void deleteRoom(String roomName) throws RoomNotFoundException, RoomNotEmptyException {
        rooms.delete(roomName);
        LOG.info("Room \"{}\" deleted", roomName);
    }

    /**
     * @return the names of the user rooms in creation order, the hall excluded
     */
    public synchronized List<String> roomNames() {
        return rooms.names();
    }

    String timestamp() {
        return TIMESTAMP.format(ZonedDateTime.now(clock));
    }
}
