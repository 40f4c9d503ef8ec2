package edchat;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ChatSessionTest {

    private final List<String> events = new ArrayList<>();

    private ChatServer server;

    private RecordingConnection connection;

    private ChatSession session;

    @BeforeEach
    void setUp() {
        server = new ChatServer("EdChat");
        connection = RecordingConnection.connect(server);
        session = connection.session();
    }

    @Test
    void rebindLeavesBeforeEntering() {
        ChatLogic first = new TracingLogic("first");
        ChatLogic second = new TracingLogic("second");

        session.rebind(first);
        session.rebind(second);
        session.rebind(first);

        assertEquals(List.of("first.enter", "first.leave", "second.enter", "second.leave", "first.enter"), events);
    }

    @Test
    void linesGoToTheBoundLogic() {
        session.rebind(new TracingLogic("room"));

        session.submitLine("hi");
        session.submitLine("");

        assertEquals(List.of("room.enter", "room.data:hi", "room.data:"), events);
    }

    @Test
    void rebindToNothingExitsTheServer() {
        session.rebind(new TracingLogic("room"));

        session.rebind(null);

        assertEquals(List.of("room.enter", "room.leave"), events);
        assertNull(session.getLogic());
        assertEquals(0, server.sessionCount());
    }

    @Test
    void disconnectUnwindsBeforeReturning() {
        session.rebind(new TracingLogic("room"));

        session.disconnect();

        assertEquals(List.of("room.enter", "room.leave"), events);
        assertNull(session.getLogic());
        assertEquals(0, server.sessionCount());
    }

    @Test
    void linesAfterTeardownAreDropped() {
        session.rebind(new TracingLogic("room"));
        session.disconnect();
        events.clear();

        session.process("too late");

        assertEquals(List.of(), events);
    }

    @Test
    void pushGoesToTheConnection() {
        connection.clear();

        session.push("one");
        session.push("two");

        assertEquals(List.of("one", "two"), connection.lines());
    }

    private final class TracingLogic implements ChatLogic {

        private final String name;

        TracingLogic(String name) {
            this.name = name;
        }

        @Override
        public void onData(ChatSession s, String line) {
            events.add(name + ".data:" + line);
        }

        @Override
        public void onEnter(ChatSession s) {
            events.add(name + ".enter");
        }

        @Override
        public void onLeave(ChatSession s) {
            events.add(name + ".leave");
        }
    }
}
