package edchat;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * First logic of every session: asks for a display name until the user
 * enters one nobody else holds, then moves the session on to the next room.
 * One instance is shared by all sessions of a server.
 */
public class NameSelectionLogic implements ChatLogic {

    private static final Logger LOG = LoggerFactory.getLogger(NameSelectionLogic.class);

    static final String PROMPT = "Please input your user name >";

    private final String serviceName;

    private final ChatLogic nextRoom;

    private final NameDirectory names;

    /**
     * @param serviceName shown in the welcome banner
     * @param nextRoom    where a session goes after choosing its name
     * @param names       the server's name directory
     */
    public NameSelectionLogic(String serviceName, ChatLogic nextRoom, NameDirectory names) {
        this.serviceName = serviceName;
        this.nextRoom = nextRoom;
        this.names = names;
    }

    @Override
    public void onEnter(ChatSession session) {
        session.push("Welcome to " + serviceName);
        session.push(PROMPT);
    }

    @Override
    public void onData(ChatSession session, String line) {
        if (line.isEmpty()) {
            session.push(PROMPT);
            return;
        }
        if (!names.register(line, session)) {
            session.push("Error: name exists.");
            session.push(PROMPT);
            return;
        }
        LOG.info("User \"{}\" logged in", line);
        session.setName(line);
        session.rebind(nextRoom);
    }

    @Override
    public void onLeave(ChatSession session) {
        // the name stays registered while the session lives on in a room
    }

    /**
     * Frees the name of a session that is going away. Sessions that never
     * registered a name are ignored.
     */
    public void release(ChatSession session) {
        names.release(session.getName(), session);
    }
}
