package edchat;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The rooms of one server: the hall plus the rooms users created, in creation
 * order. The hall is kept apart from the user rooms, so it can neither be
 * looked up, listed nor deleted by name.
 *
 * <p>
 * Not thread safe, all access goes through the synchronized methods of
 * {@link ChatServer}.
 * </p>
 */
public class RoomRegistry {

    private final ChatServer server;

    private final RoomChatLogic hall;

    private final Map<String, RoomChatLogic> rooms = new LinkedHashMap<>();

    public RoomRegistry(ChatServer server, String hallName) {
        this.server = server;
        this.hall = new RoomChatLogic(server, hallName);
    }

    public RoomChatLogic getHall() {
        return hall;
    }

    /**
     * Creates an empty room named {@code name} unless one exists.
     *
     * @return true if a room was created
     */
    public boolean create(String name) {
        if (rooms.containsKey(name)) {
            return false;
        }
        rooms.put(name, new RoomChatLogic(server, name));
        return true;
    }

    public RoomChatLogic lookup(String name) throws RoomNotFoundException {
        RoomChatLogic room = rooms.get(name);
        if (room == null) {
            throw new RoomNotFoundException(name);
        }
        return room;
    }

    /**
     * Removes the room named {@code name}.
     *
     * @throws RoomNotFoundException if there is no such room
     * @throws RoomNotEmptyException if sessions are still in the room
     */
    public void delete(String name) throws RoomNotFoundException, RoomNotEmptyException {
        RoomChatLogic room = lookup(name);
        if (!room.isEmpty()) {
            throw new RoomNotEmptyException(name);
        }
        rooms.remove(name);
    }

    public List<String> names() {
        return new ArrayList<>(rooms.keySet());
    }
}
