package edchat;

import java.io.Closeable;
import java.io.IOException;

/**
 * ========================== SERVER INTERFACE ==========================
 *
 * A network server exchanging messages of type T with its clients.
 * The Reactor is the implementation used by the chat application.
 * =====================================================================
 */
public interface Server<T> extends Closeable {

    /**
     * Runs the accept and I/O loop on the calling thread until the server
     * is closed or the thread is interrupted.
     */
    void serve();

    /**
     * Stops the loop started by {@link #serve()}.
     *
     * @throws IOException if an I/O error occurs while closing
     */
    @Override
    void close() throws IOException;
}
