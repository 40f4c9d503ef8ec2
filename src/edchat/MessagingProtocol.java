package edchat;

/**
 * =================== MESSAGING PROTOCOL INTERFACE ====================
 *
 * The "brains" of a connection: what happens when a message arrives.
 *
 *   - The Reactor handles the plumbing (sockets, selector)
 *   - The EncoderDecoder handles the translation (bytes <-> messages)
 *   - The Protocol decides what to DO with each message
 *
 * Each connection gets its OWN protocol instance (see the protocol
 * factory passed to the Reactor). Replies are not returned from
 * process(): the protocol pushes any number of messages, to its own
 * connection or to others, through ConnectionHandler.send().
 *
 * LIFECYCLE (all calls for one connection happen one at a time):
 *   start(connection) -> process(msg)* -> connectionClosed()
 * =====================================================================
 */
public interface MessagingProtocol<T> {

    /**
     * Called once, right after the connection was accepted.
     *
     * @param connection the connection this protocol instance serves
     */
    void start(ConnectionHandler<T> connection);

    /**
     * Called for every complete message received from the peer.
     *
     * @param msg the decoded message
     */
    void process(T msg);

    /**
     * Called once when the connection goes away, whether the peer hung
     * up or the server closed it.
     */
    void connectionClosed();
}
