package edchat;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SelectionKey;
import java.nio.channels.SocketChannel;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ============= NON-BLOCKING CONNECTION HANDLER =======================
 *
 * WHAT IS THIS?
 * Manages a single client connection using non-blocking I/O. Each
 * connected client gets its own handler, which:
 *   1. reads bytes from the channel (continueRead)
 *   2. decodes them into lines and hands each line to the protocol
 *   3. queues whatever the protocol sends (send)
 *   4. writes the queued bytes when the channel is writable
 *      (continueWrite)
 *
 * THREADS
 * continueRead() and continueWrite() run on the Reactor's selector
 * thread. continueRead() only pulls the bytes off the socket and
 * returns a Runnable that does the decoding and the protocol work; the
 * Reactor runs it on the ActorThreadPool with this handler as the
 * actor, so one connection's lines are handled in order.
 *
 * send() can be called from ANY worker thread (a broadcast in a chat
 * room pushes to every member's handler). It only enqueues bytes and
 * asks the Reactor to watch the channel for OP_WRITE.
 *
 * CLOSING
 * close() tells the protocol first, then closes the channel as soon as
 * the write queue is empty, so a last "Bye!" still reaches the peer.
 * Peer EOF is turned into a close() task queued behind the lines that
 * were already read. abort() is the hard variant used on shutdown and
 * on overflow: pending output is dropped and the channel closed at once.
 *
 * OVERFLOW
 * A peer that stops reading cannot grow its queue without bound. Once
 * more than MAX_PENDING_BYTES are waiting, further sends are dropped and
 * an abort() task is queued for this connection. The abort cannot run
 * inline: send() is usually called from a room broadcast that is still
 * walking the member list.
 * =====================================================================
 */
public class NonBlockingConnectionHandler<T> implements ConnectionHandler<T> {

    private static final Logger LOG = LoggerFactory.getLogger(NonBlockingConnectionHandler.class);

    private static final int BUFFER_ALLOCATION_SIZE = 1 << 13; //8k

    static final long MAX_PENDING_BYTES = 1 << 20; //1M

    // Read buffers are shared by all handlers.
    private static final ConcurrentLinkedQueue<ByteBuffer> BUFFER_POOL = new ConcurrentLinkedQueue<>();

    private final MessagingProtocol<T> protocol;

    private final MessageEncoderDecoder<T> encdec;

    private final Queue<ByteBuffer> writeQueue = new ConcurrentLinkedQueue<>();

    private final SocketChannel chan;

    private final Reactor<T> reactor;

    private final AtomicBoolean closed = new AtomicBoolean();

    private final AtomicBoolean overflowed = new AtomicBoolean();

    private final AtomicLong pendingBytes = new AtomicLong();

    /**
     * @param reader   the encoder/decoder for this connection's messages
     * @param protocol the protocol instance serving this connection
     * @param chan     the accepted client channel
     * @param reactor  the Reactor managing this connection
     */
    public NonBlockingConnectionHandler(
            MessageEncoderDecoder<T> reader,
            MessagingProtocol<T> protocol,
            SocketChannel chan,
            Reactor<T> reactor) {
        this.chan = chan;
        this.encdec = reader;
        this.protocol = protocol;
        this.reactor = reactor;
    }

    /**
     * Hands this connection to its protocol. Runs as the first task of the
     * connection on the worker pool.
     */
    public void start() {
        if (!closed.get()) {
            protocol.start(this);
        }
    }

    /**
     * Reads what is available on the channel.
     *
     * @return the task that decodes the bytes and feeds complete lines to
     *         the protocol, or a close task if the peer hung up
     */
    public Runnable continueRead() {
        ByteBuffer buf = leaseBuffer();

        boolean success = false;
        try {
            success = chan.read(buf) != -1;
        } catch (IOException ex) {
            LOG.debug("Read from {} failed: {}", remoteAddress(), ex.toString());
        }

        if (success) {
            buf.flip();
            return () -> {
                try {
                    while (buf.hasRemaining()) {
                        T nextMessage = encdec.decodeNextByte(buf.get());
                        if (nextMessage != null && !closed.get()) {
                            protocol.process(nextMessage);
                        }
                    }
                } finally {
                    releaseBuffer(buf);
                }
            };
        } else {
            releaseBuffer(buf);
            // stop reporting EOF until the close task has run
            reactor.updateInterestedOps(chan, 0);
            return this::close;
        }
    }

    @Override
    public void send(T msg) {
        if (closed.get() || overflowed.get()) {
            return;
        }
        byte[] bytes = encdec.encode(msg);
        if (pendingBytes.addAndGet(bytes.length) > MAX_PENDING_BYTES) {
            pendingBytes.addAndGet(-bytes.length);
            if (overflowed.compareAndSet(false, true)) {
                LOG.warn("Output to {} exceeds {} bytes, dropping connection", remoteAddress(), MAX_PENDING_BYTES);
                reactor.submit(this, this::abort);
            }
            return;
        }
        writeQueue.add(ByteBuffer.wrap(bytes));
        reactor.updateInterestedOps(chan, SelectionKey.OP_READ | SelectionKey.OP_WRITE);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        LOG.debug("Closing connection {}", remoteAddress());
        try {
            protocol.connectionClosed();
        } finally {
            if (writeQueue.isEmpty()) {
                closeChannel();
            } else {
                reactor.updateInterestedOps(chan, SelectionKey.OP_WRITE);
            }
        }
    }

    /**
     * Closes the connection without flushing: the protocol is told as in
     * close(), then pending output is discarded and the channel closed.
     */
    public void abort() {
        try {
            close();
        } finally {
            writeQueue.clear();
            pendingBytes.set(0);
            closeChannel();
        }
    }

    /**
     * Number of encoded bytes queued but not yet written.
     */
    long pendingBytes() {
        return pendingBytes.get();
    }

    /**
     * Writes queued bytes until the queue is empty or the socket buffer is
     * full. Once everything is written the channel goes back to read
     * interest, or is closed if close() was requested meanwhile.
     */
    public void continueWrite() {
        while (!writeQueue.isEmpty()) {
            try {
                ByteBuffer top = writeQueue.peek();
                if (top == null) {
                    break;
                }
                chan.write(top);
                if (top.hasRemaining()) {
                    return;
                }
                writeQueue.poll();
                pendingBytes.addAndGet(-top.capacity());
            } catch (IOException ex) {
                LOG.warn("Write to {} failed, dropping connection: {}", remoteAddress(), ex.toString());
                abort();
                return;
            }
        }

        if (closed.get()) {
            closeChannel();
        } else {
            reactor.updateInterestedOps(chan, SelectionKey.OP_READ);
        }
    }

    private void closeChannel() {
        try {
            chan.close();
        } catch (IOException ex) {
            LOG.warn("Failed to close channel", ex);
        }
    }

    private Object remoteAddress() {
        return chan.socket().getRemoteSocketAddress();
    }

    private static ByteBuffer leaseBuffer() {
        ByteBuffer buff = BUFFER_POOL.poll();
        if (buff == null) {
            return ByteBuffer.allocateDirect(BUFFER_ALLOCATION_SIZE);
        }
        buff.clear();
        return buff;
    }

    private static void releaseBuffer(ByteBuffer buff) {
        BUFFER_POOL.add(buff);
    }
}
