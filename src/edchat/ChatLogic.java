package edchat;

/**
 * Behaviour currently governing a {@link ChatSession}. A session is bound to
 * exactly one logic at a time and switches with {@link ChatSession#rebind}.
 * For every logic instance, enter and leave calls come in pairs.
 */
public interface ChatLogic {

    /**
     * A complete line typed by the user of {@code session}.
     */
    void onData(ChatSession session, String line);

    /**
     * {@code session} has just been bound to this logic.
     */
    void onEnter(ChatSession session);

    /**
     * {@code session} is about to be bound elsewhere, or is disconnecting.
     */
    void onLeave(ChatSession session);
}
