package edchat;

import java.util.HashMap;
import java.util.Map;

/**
 * Display names held by live sessions. Not thread safe, guarded by the
 * owning {@link ChatServer}.
 */
public class NameDirectory {

    private final Map<String, ChatSession> holders = new HashMap<>();

    /**
     * Claims {@code name} for {@code holder}.
     *
     * @return false if another session already holds the name
     */
    public boolean register(String name, ChatSession holder) {
        return holders.putIfAbsent(name, holder) == null;
    }

    /**
     * Frees {@code name} if {@code holder} holds it, otherwise does nothing.
     */
    public void release(String name, ChatSession holder) {
        holders.remove(name, holder);
    }

    public boolean contains(String name) {
        return holders.containsKey(name);
    }

    public int size() {
        return holders.size();
    }
}
