package edchat;

/**
 * No user room with the requested name exists.
 */
public class RoomNotFoundException extends ChatException {

    private static final long serialVersionUID = 1L;

    private final String roomName;

    public RoomNotFoundException(String roomName) {
        super("No such room: " + roomName);
        this.roomName = roomName;
    }

    public String getRoomName() {
        return roomName;
    }
}
