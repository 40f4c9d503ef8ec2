package edchat;

/**
 * Base class of the recoverable chat errors. They are answered with an error
 * line to the user who caused them and never end a connection.
 */
public class ChatException extends Exception {

    private static final long serialVersionUID = 1L;

    public ChatException(String message) {
        super(message);
    }
}
