package edchat;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RoomChatLogicTest {

    private static final String NOW = "Mon Oct 19 20:31:07 2026";

    private ChatServer server;

    private final List<String> journal = new ArrayList<>();

    @BeforeEach
    void setUp() {
        server = new ChatServer("EdChat", Clock.fixed(Instant.parse("2026-10-19T20:31:07Z"), ZoneOffset.UTC));
    }

    private RecordingConnection login(String name) {
        return RecordingConnection.login(server, name, journal);
    }

    @Test
    void enteringTheHallGreetsAndAnnounces() {
        RecordingConnection alice = login("alice");
        RecordingConnection bob = RecordingConnection.connect(server);
        bob.clear();

        bob.type("bob");

        assertEquals(List.of("Welcome to EdChat Hall", NOW + ": \"bob\" enters room."), bob.lines());
        assertEquals(List.of(NOW + ": \"bob\" enters room."), alice.lines());
    }

    @Test
    void plainLineIsBroadcastToEveryMemberInJoinOrder() {
        RecordingConnection a = login("a");
        RecordingConnection b = login("b");
        RecordingConnection c = login("c");
        a.clear();
        b.clear();
        c.clear();
        journal.clear();

        b.type("hello there");

        String message = NOW + ": \"b\" says:\nhello there";
        assertEquals(List.of(message), a.lines());
        assertEquals(List.of(message), b.lines());
        assertEquals(List.of(message), c.lines());
        assertEquals(List.of("a: " + message, "b: " + message, "c: " + message), journal);
    }

    @Test
    void emptyLineIsIgnored() {
        RecordingConnection a = login("a");
        RecordingConnection b = login("b");
        a.clear();

        b.type("");

        assertTrue(a.lines().isEmpty());
        assertTrue(b.lines().isEmpty());
    }

    @Test
    void whoListsCurrentMembers() {
        RecordingConnection a = login("a");
        RecordingConnection b = login("b");
        RecordingConnection c = login("c");
        b.hangUp();
        c.clear();

        c.type("/who");

        assertEquals(List.of("a", "c"), c.lines());
    }

    @Test
    void unknownActionOnlyAnswersTheIssuer() {
        RecordingConnection a = login("a");
        RecordingConnection b = login("b");
        a.clear();

        b.type("/dance wildly");

        assertEquals(List.of("Error: unknown action: dance"), b.lines());
        assertTrue(a.lines().isEmpty());
        assertSame(server.getHall(), b.session().getLogic());
    }

    @Test
    void bareSlashIsAnUnknownAction() {
        RecordingConnection a = login("a");

        a.type("/");

        assertEquals(List.of("Error: unknown action: "), a.lines());
    }

    @Test
    void addRoomIsIdempotent() {
        RecordingConnection a = login("a");

        a.type("/addroom lounge");
        a.type("/addroom lounge");

        assertEquals(List.of("Info: add new room \"lounge\"", "Info: add new room \"lounge\""), a.lines());
        assertEquals(List.of("lounge"), server.roomNames());
    }

    @Test
    void argumentsAreSplitOnRunsOfSpaces() {
        RecordingConnection a = login("a");

        a.type("/addroom   lounge");

        assertEquals(List.of("lounge"), server.roomNames());
    }

    @Test
    void gotoRoomMovesTheSession() throws Exception {
        RecordingConnection a = login("a");
        RecordingConnection b = login("b");
        a.type("/addroom lounge");
        a.clear();
        b.clear();

        a.type("/gotoroom lounge");

        RoomChatLogic lounge = server.getRoom("lounge");
        assertSame(lounge, a.session().getLogic());
        assertEquals(List.of(b.session()), server.getHall().getMembers());
        assertEquals(List.of(NOW + ": \"a\" leaves room."), b.lines());
        assertEquals(List.of("Welcome to lounge", NOW + ": \"a\" enters room."), a.lines());
    }

    @Test
    void gotoMissingRoomChangesNothing() {
        RecordingConnection a = login("a");
        RecordingConnection b = login("b");
        a.clear();
        b.clear();

        a.type("/gotoroom nosuchroom");

        assertEquals(List.of("Error: no such room."), a.lines());
        assertTrue(b.lines().isEmpty());
        assertSame(server.getHall(), a.session().getLogic());
        assertEquals(List.of(a.session(), b.session()), server.getHall().getMembers());
    }

    @Test
    void roomCommandsWithoutNameAreRejected() {
        RecordingConnection a = login("a");

        a.type("/addroom");
        a.type("/gotoroom");
        a.type("/delroom ");

        String error = "Error: missing room name, see /help";
        assertEquals(List.of(error, error, error), a.lines());
        assertTrue(server.roomNames().isEmpty());
        assertSame(server.getHall(), a.session().getLogic());
    }

    @Test
    void deleteRoomFailsWhileOccupied() throws Exception {
        RecordingConnection a = login("a");
        RecordingConnection b = login("b");
        a.type("/addroom lounge");
        b.type("/gotoroom lounge");
        a.clear();

        a.type("/delroom lounge");

        assertEquals(List.of("Error: room \"lounge\" is not empty, can not delete it"), a.lines());
        assertSame(server.getRoom("lounge"), b.session().getLogic());

        b.type("/hall");
        a.clear();
        a.type("/delroom lounge");
        assertEquals(List.of("Info: delete room \"lounge\""), a.lines());

        a.clear();
        a.type("/gotoroom lounge");
        assertEquals(List.of("Error: no such room."), a.lines());
    }

    @Test
    void deleteMissingRoom() {
        RecordingConnection a = login("a");

        a.type("/delroom attic");

        assertEquals(List.of("Error: no such room \"attic\""), a.lines());
    }

    @Test
    void roomListShowsUserRoomsInCreationOrder() {
        RecordingConnection a = login("a");
        a.type("/addroom zoo");
        a.type("/addroom attic");
        a.clear();

        a.type("/roomlist");

        assertEquals(List.of("Info: room list", "\t zoo", "\t attic", "room list over"), a.lines());
    }

    @Test
    void hallReturnsToTheHall() throws Exception {
        RecordingConnection a = login("a");
        a.type("/addroom lounge");
        a.type("/gotoroom lounge");
        a.clear();

        a.type("/hall");

        assertSame(server.getHall(), a.session().getLogic());
        assertTrue(server.getRoom("lounge").isEmpty());
        assertEquals(List.of("Welcome to EdChat Hall", NOW + ": \"a\" enters room."), a.lines());
    }

    @Test
    void helpListsEveryAction() {
        RecordingConnection a = login("a");

        a.type("/help");

        List<String> lines = a.lines();
        assertEquals("Info: action list", lines.get(0));
        for (String action : List.of("addroom", "delroom", "gotoroom", "hall", "help", "quit", "roomlist", "who")) {
            assertTrue(lines.stream().anyMatch(line -> line.startsWith("/" + action)), action);
        }
        assertTrue(lines.contains("/hall\n\tGoto EdChat Hall"));
    }

    @Test
    void quitSaysByeAndLeaves() {
        RecordingConnection a = login("a");
        RecordingConnection b = login("b");
        a.clear();
        b.clear();

        a.type("/quit");

        assertEquals(List.of("Bye!"), a.lines());
        assertTrue(a.isClosed());
        assertEquals(List.of(NOW + ": \"a\" leaves room."), b.lines());
        assertEquals(List.of(b.session()), server.getHall().getMembers());
        assertEquals(1, server.sessionCount());
    }

    @Test
    void leavingWithoutMembershipIsAFault() {
        RoomChatLogic room = new RoomChatLogic(server, "side");
        ChatSession stranger = server.newSession();

        assertThrows(IllegalStateException.class, () -> room.onLeave(stranger));
    }
}
