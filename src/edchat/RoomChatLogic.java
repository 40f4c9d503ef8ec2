package edchat;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ======================== CHAT ROOM LOGIC ============================
 *
 * A named room. Plain lines are broadcast to every member, lines
 * starting with '/' are commands:
 *
 *   /quit               leave the chat
 *   /who                list the members of this room
 *   /addroom name       create a room (no-op if it exists)
 *   /gotoroom name      move to another room
 *   /delroom name       delete an empty room
 *   /roomlist           list the rooms users created
 *   /hall               move to the hall
 *   /help               show the commands
 *
 * Commands are looked up by name in ACTIONS. An unknown name is
 * answered with an error line to the issuer only.
 *
 * MEMBERS
 * The member list holds the sessions in join order and never owns
 * them; the ChatServer does. A broadcast pushes to each member in
 * that order, the sender included.
 * =====================================================================
 */
public class RoomChatLogic implements ChatLogic {

    private static final Logger LOG = LoggerFactory.getLogger(RoomChatLogic.class);

    // action name + up to 5 arguments
    private static final int MAX_TOKENS = 6;

    private static final Map<String, RoomAction> ACTIONS;

    static {
        Map<String, RoomAction> actions = new LinkedHashMap<>();
        actions.put("quit", RoomChatLogic::quit);
        actions.put("who", RoomChatLogic::who);
        actions.put("addroom", RoomChatLogic::addRoom);
        actions.put("gotoroom", RoomChatLogic::gotoRoom);
        actions.put("delroom", RoomChatLogic::deleteRoom);
        actions.put("roomlist", RoomChatLogic::roomList);
        actions.put("hall", RoomChatLogic::hall);
        actions.put("help", RoomChatLogic::help);
        ACTIONS = Collections.unmodifiableMap(actions);
    }

    private final ChatServer server;

    private final String name;

    private final List<ChatSession> members = new ArrayList<>();

    public RoomChatLogic(ChatServer server, String name) {
        this.server = server;
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    /**
     * @return the current members in join order
     */
    public List<ChatSession> getMembers() {
        return Collections.unmodifiableList(members);
    }

    @Override
    public void onEnter(ChatSession session) {
        members.add(session);
        session.push("Welcome to " + name);
        broadcastUserState(session, "enters room");
    }

    @Override
    public void onLeave(ChatSession session) {
        if (!members.remove(session)) {
            throw new IllegalStateException(session + " is not a member of room " + name);
        }
        broadcastUserState(session, "leaves room");
    }

    @Override
    public void onData(ChatSession session, String line) {
        if (line.isEmpty()) {
            return;
        }
        if (line.charAt(0) == '/') {
            List<String> tokens = Arrays.asList(line.substring(1).split(" +", MAX_TOKENS));
            dispatch(session, tokens.get(0), tokens.subList(1, tokens.size()));
            return;
        }
        broadcast(server.timestamp() + ": \"" + session.getName() + "\" says:\n" + line);
    }

    private void dispatch(ChatSession session, String action, List<String> args) {
        RoomAction handler = ACTIONS.get(action);
        if (handler == null) {
            session.push("Error: unknown action: " + action);
            return;
        }
        handler.execute(this, session, args);
    }

    private void broadcastUserState(ChatSession session, String state) {
        broadcast(server.timestamp() + ": \"" + session.getName() + "\" " + state + ".");
    }

    private void broadcast(String text) {
        for (ChatSession member : members) {
            member.push(text);
        }
    }

    // --- actions ---

    private void quit(ChatSession session, List<String> args) {
        session.push("Bye!");
        session.disconnect();
    }

    private void who(ChatSession session, List<String> args) {
        for (ChatSession member : members) {
            session.push(member.getName());
        }
    }

    private void addRoom(ChatSession session, List<String> args) {
        String roomName = roomArgument(session, args);
        if (roomName == null) {
            return;
        }
        server.addRoom(roomName);
        session.push("Info: add new room \"" + roomName + "\"");
    }

    private void gotoRoom(ChatSession session, List<String> args) {
        String roomName = roomArgument(session, args);
        if (roomName == null) {
            return;
        }
        RoomChatLogic target;
        try {
            target = server.getRoom(roomName);
        } catch (RoomNotFoundException ex) {
            session.push("Error: no such room.");
            return;
        }
        session.rebind(target);
    }

    private void deleteRoom(ChatSession session, List<String> args) {
        String roomName = roomArgument(session, args);
        if (roomName == null) {
            return;
        }
        try {
            server.deleteRoom(roomName);
        } catch (RoomNotFoundException ex) {
            session.push("Error: no such room \"" + roomName + "\"");
            return;
        } catch (RoomNotEmptyException ex) {
            session.push("Error: room \"" + roomName + "\" is not empty, can not delete it");
            return;
        }
        session.push("Info: delete room \"" + roomName + "\"");
    }

    private void roomList(ChatSession session, List<String> args) {
        session.push("Info: room list");
        for (String roomName : server.roomNames()) {
            session.push("\t " + roomName);
        }
        session.push("room list over");
    }

    private void hall(ChatSession session, List<String> args) {
        session.rebind(server.getHall());
    }

    private void help(ChatSession session, List<String> args) {
        session.push("Info: action list");
        session.push("/addroom room_name\n\tAdd a new room");
        session.push("/delroom room_name\n\tDelete the room");
        session.push("/gotoroom room_name\n\tGoto another room");
        session.push("/hall\n\tGoto " + server.getHall().getName());
        session.push("/help\n\tShow this help");
        session.push("/quit\n\tQuit " + server.getServiceName());
        session.push("/roomlist\n\tShow all rooms");
        session.push("/who\n\tShow all room members");
    }

    private static String roomArgument(ChatSession session, List<String> args) {
        if (args.isEmpty() || args.get(0).isEmpty()) {
            LOG.debug("{} sent a room command without room name", session);
            session.push("Error: missing room name, see /help");
            return null;
        }
        return args.get(0);
    }

    @Override
    public String toString() {
        return "RoomChatLogic[" + name + "]";
    }
}
