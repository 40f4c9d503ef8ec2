package edchat;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Start-up settings of the chat server.
 *
 * Resolution order (high to low):
 * 1) command line: {@code [port] [name]}
 * 2) Java system properties ({@code -Dedchat.port=6000})
 * 3) environment variables ({@code EDCHAT_PORT})
 * 4) {@code edchat.properties} on the class path
 * 5) built-in defaults
 */
public final class ChatConfig {

    private static final Logger LOG = LoggerFactory.getLogger(ChatConfig.class);

    static final String CONFIG_FILE_NAME = "edchat.properties";

    public static final String PORT = "edchat.port";
    public static final String NAME = "edchat.name";
    public static final String THREADS = "edchat.threads";

    public static final int DEFAULT_PORT = 5005;
    public static final String DEFAULT_NAME = "EdChat";

    private final int port;

    private final String name;

    private final int threads;

    public ChatConfig(int port, String name, int threads) {
        this.port = port;
        this.name = name;
        this.threads = threads;
    }

    /**
     * Resolves the configuration of the running process.
     */
    public static ChatConfig load(String[] args) {
        return resolve(args, System.getProperties(), System.getenv(), loadFile());
    }

    /**
     * Resolves a configuration from explicit sources.
     *
     * @throws IllegalArgumentException if a numeric setting is not a number
     *         or out of range: the port must lie in 0..65535 (0 picks a
     *         free port), the thread count must be positive
     */
    static ChatConfig resolve(String[] args, Properties system, Map<String, String> env, Properties file) {
        String port = args.length > 0 ? args[0] : lookup(PORT, system, env, file);
        String name = args.length > 1 ? args[1] : lookup(NAME, system, env, file);
        String threads = lookup(THREADS, system, env, file);

        return new ChatConfig(
                port == null ? DEFAULT_PORT : parseInt(PORT, port, 0, 65535),
                name == null ? DEFAULT_NAME : name,
                threads == null ? Runtime.getRuntime().availableProcessors()
                        : parseInt(THREADS, threads, 1, Integer.MAX_VALUE));
    }

    private static String lookup(String key, Properties system, Map<String, String> env, Properties file) {
        String v = system.getProperty(key);
        if (v != null && !v.isEmpty()) {
            return v;
        }
        v = env.get(key.replace('.', '_').toUpperCase(Locale.ROOT));
        if (v != null && !v.isEmpty()) {
            return v;
        }
        v = file.getProperty(key);
        return (v == null || v.isEmpty()) ? null : v;
    }

    private static int parseInt(String key, String value, int min, int max) {
        int result;
        try {
            result = Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, ex);
        }
        if (result < min || result > max) {
            throw new IllegalArgumentException(
                    "Invalid value for " + key + ": " + value + " (expected " + min + ".." + max + ")");
        }
        return result;
    }

    private static Properties loadFile() {
        Properties props = new Properties();
        try (InputStream in = ChatConfig.class.getClassLoader().getResourceAsStream(CONFIG_FILE_NAME)) {
            if (in != null) {
                props.load(in);
            } else {
                LOG.debug("No {} on the class path, using defaults", CONFIG_FILE_NAME);
            }
        } catch (IOException ex) {
            LOG.warn("Failed to read {}; falling back to system properties and environment variables",
                    CONFIG_FILE_NAME, ex);
        }
        return props;
    }

    public int getPort() {
        return port;
    }

    public String getName() {
        return name;
    }

    public int getThreads() {
        return threads;
    }

    @Override
    public String toString() {
        return "ChatConfig[port=" + port + ", name=" + name + ", threads=" + threads + "]";
    }
}
