package edchat;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.channels.CancelledKeyException;
import java.nio.channels.ClosedSelectorException;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ========================== THE REACTOR ==============================
 *
 * WHAT IS THIS?
 * The network side of the chat server. ONE selector thread watches
 * every connection; the work a message causes runs on an
 * ActorThreadPool, so a slow client never holds up the others.
 *
 * HOW THIS CLASS WORKS:
 * 1. Opens a ServerSocketChannel and registers it with a Selector
 * 2. Enters the event loop in serve():
 *    a. selector.select() blocks until something happens on ANY channel
 *    b. runs the tasks queued by worker threads (interest op changes)
 *    c. for each ready key:
 *       - ACCEPT -> handleAccept(): new handler, new protocol instance,
 *         the protocol's start() queued as the connection's first task
 *       - READ   -> the handler reads; the returned task goes to the pool
 *       - WRITE  -> the handler flushes its write queue
 * 3. close() wakes the selector and ends the loop. The workers are
 *    stopped, then every open connection is aborted, which unwinds its
 *    protocol, and finally the selector and server socket are closed.
 *
 * FACTORIES
 * Every connection gets a fresh protocol and a fresh encoder/decoder
 * from the two Suppliers, since both keep per-connection state.
 * =====================================================================
 */
public class Reactor<T> implements Server<T> {

    private static final Logger LOG = LoggerFactory.getLogger(Reactor.class);

    // 0 binds an ephemeral port, see getPort()
    private final int port;

    private final Supplier<MessagingProtocol<T>> protocolFactory;

    private final Supplier<MessageEncoderDecoder<T>> readerFactory;

    private final ActorThreadPool<NonBlockingConnectionHandler<T>> pool;

    private volatile Selector selector;

    private volatile boolean closing;

    private volatile int boundPort = -1;

    private final CountDownLatch started = new CountDownLatch(1);

    private Thread selectorThread;

    // SelectionKeys may only be changed on the selector thread; workers queue their changes here.
    private final ConcurrentLinkedQueue<Runnable> selectorTasks = new ConcurrentLinkedQueue<>();

    /**
     * Creates a new Reactor server.
     *
     * @param numThreads      number of worker threads in the thread pool
     * @param port            TCP port to listen on, 0 for an ephemeral port
     * @param protocolFactory creates a new protocol instance per client
     * @param readerFactory   creates a new encoder/decoder instance per client
     */
    public Reactor(int numThreads, int port, Supplier<MessagingProtocol<T>> protocolFactory,
            Supplier<MessageEncoderDecoder<T>> readerFactory) {
        this.pool = new ActorThreadPool<>(numThreads);
        this.port = port;
        this.protocolFactory = protocolFactory;
        this.readerFactory = readerFactory;
    }

    @Override
    public void serve() {
        selectorThread = Thread.currentThread();

        try (Selector selector = Selector.open();
                ServerSocketChannel serverSock = ServerSocketChannel.open()) {

            this.selector = selector;

            serverSock.bind(new InetSocketAddress(port));
            serverSock.configureBlocking(false);
            serverSock.register(selector, SelectionKey.OP_ACCEPT);

            boundPort = ((InetSocketAddress) serverSock.getLocalAddress()).getPort();
            LOG.info("Listening on port {}", boundPort);
            started.countDown();

            try {
                // ==================== THE EVENT LOOP ====================
                while (!closing && !Thread.currentThread().isInterrupted()) {

                    selector.select();
                    runSelectionThreadTasks();

                    for (SelectionKey key : selector.selectedKeys()) {
                        try {
                            if (!key.isValid()) {
                                continue;
                            } else if (key.isAcceptable()) {
                                handleAccept(serverSock, selector);
                            } else {
                                handleReadWrite(key);
                            }
                        } catch (CancelledKeyException ex) {
                            // a worker closed the channel after select() returned
                            LOG.debug("Skipping cancelled key {}", key);
                        }
                    }
                    selector.selectedKeys().clear();
                }
                // ========================================================
            } finally {
                // no worker may touch a session while the connections are torn down
                pool.shutdown();
                abortConnections(selector);
            }

        } catch (ClosedSelectorException ex) {
            LOG.debug("Selector closed underneath the event loop");
        } catch (IOException ex) {
            LOG.error("Reactor stopped on I/O error", ex);
        } finally {
            started.countDown();
        }

        LOG.info("Server closed");
        pool.shutdown();
    }

    /**
     * Blocks until serve() has bound its socket.
     *
     * @return the bound port, or -1 if the server failed to start in time
     */
    public int awaitStarted(long timeout, TimeUnit unit) throws InterruptedException {
        started.await(timeout, unit);
        return boundPort;
    }

    /**
     * @return the port the server listens on, -1 before serve() bound it
     */
    public int getPort() {
        return boundPort;
    }

    /**
     * Changes the events watched for {@code chan}. Safe to call from any
     * thread: off the selector thread the change is queued and the selector
     * woken up.
     */
    void updateInterestedOps(SocketChannel chan, int ops) {
        final SelectionKey key = chan.keyFor(selector);
        if (key == null) {
            return;
        }
        if (Thread.currentThread() == selectorThread) {
            if (key.isValid()) {
                key.interestOps(ops);
            }
        } else {
            selectorTasks.add(() -> {
                if (key.isValid())
                    key.interestOps(ops);
            });
            selector.wakeup();
        }
    }

    private void handleAccept(ServerSocketChannel serverChan, Selector selector) throws IOException {
        SocketChannel clientChan = serverChan.accept();
        if (clientChan == null) {
            return;
        }
        clientChan.configureBlocking(false);
        final NonBlockingConnectionHandler<T> handler = new NonBlockingConnectionHandler<>(
                readerFactory.get(),
                protocolFactory.get(),
                clientChan, this);
        clientChan.register(selector, SelectionKey.OP_READ, handler);
        LOG.debug("Accepted connection from {}", clientChan.getRemoteAddress());
        pool.submit(handler, handler::start);
    }

    @SuppressWarnings("unchecked") // attachment set in handleAccept()
    private void handleReadWrite(SelectionKey key) {
        NonBlockingConnectionHandler<T> handler = (NonBlockingConnectionHandler<T>) key.attachment();

        if (key.isReadable()) {
            Runnable task = handler.continueRead();
            if (task != null) {
                pool.submit(handler, task);
            }
        }

        if (key.isValid() && key.isWritable()) {
            handler.continueWrite();
        }
    }

    /**
     * Queues {@code task} on the worker pool behind the tasks already
     * submitted for {@code handler}. Once the pool is stopped the task is
     * dropped: shutdown aborts every connection itself.
     */
    void submit(NonBlockingConnectionHandler<T> handler, Runnable task) {
        try {
            pool.submit(handler, task);
        } catch (RejectedExecutionException ex) {
            LOG.debug("Pool stopped, dropping task of {}", handler);
        }
    }

    private void abortConnections(Selector selector) {
        List<SelectionKey> keys = new ArrayList<>(selector.keys());
        for (SelectionKey key : keys) {
            if (key.attachment() instanceof NonBlockingConnectionHandler) {
                ((NonBlockingConnectionHandler<?>) key.attachment()).abort();
            }
        }
        LOG.debug("Aborted {} connection(s)", keys.size() - 1);
    }

    private void runSelectionThreadTasks() {
        while (!selectorTasks.isEmpty()) {
            selectorTasks.remove().run();
        }
    }

    /**
     * Stops serve(): the loop ends, the workers stop and every open
     * connection is closed with its protocol told through
     * connectionClosed(). A Reactor that never served just stops its pool.
     */
    @Override
    public void close() throws IOException {
        closing = true;
        Selector current = selector;
        if (current != null) {
            current.wakeup();
        } else {
            pool.shutdown();
        }
    }
}
