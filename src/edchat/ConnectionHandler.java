package edchat;

/**
 * =================== CONNECTION HANDLER INTERFACE ====================
 *
 * One client connection as seen by the protocol running on it: the
 * protocol can push messages to the peer at any time and can hang up.
 *
 * NonBlockingConnectionHandler implements it on top of an NIO channel.
 * Tests use an in-memory implementation that records what was sent.
 * =====================================================================
 */
public interface ConnectionHandler<T> {

    /**
     * Queues {@code msg} for delivery to the peer. Messages arrive in the
     * order they were sent. Sending on a closed connection does nothing.
     */
    void send(T msg);

    /**
     * Closes the connection. Before this returns the protocol has been told
     * through {@link MessagingProtocol#connectionClosed()}. Messages sent
     * before the call are still flushed to the peer. Closing twice is a
     * no-op.
     */
    void close();
}
