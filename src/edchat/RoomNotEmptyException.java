package edchat;

/**
 * A room cannot be deleted while sessions are in it.
 */
public class RoomNotEmptyException extends ChatException {

    private static final long serialVersionUID = 1L;

    private final String roomName;

    public RoomNotEmptyException(String roomName) {
        super("Room is not empty: " + roomName);
        this.roomName = roomName;
    }

    public String getRoomName() {
        return roomName;
    }
}
