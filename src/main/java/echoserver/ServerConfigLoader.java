package echoserver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Properties;

/**
 * Builds a {@link ServerConfig} from {@code echo-server.properties} on the classpath,
 * overlaid with an optional operator file.
 */
public final class ServerConfigLoader {

    static final String DEFAULTS_RESOURCE = "/echo-server.properties";

    static final String ADDRESS = "echo.address";
    static final String REUSE_ADDRESS = "echo.reuse-address";
    static final String REUSE_PORT = "echo.reuse-port";
    static final String BACKLOG = "echo.backlog";
    static final String MODE = "echo.mode";
    static final String READ_TIMEOUT_MS = "echo.read-timeout-ms";

    private static final Logger logger = LoggerFactory.getLogger(ServerConfigLoader.class);

    private ServerConfigLoader() {
    }

    /**
     * @param path operator properties file; {@code null} or a missing file means defaults only
     * @throws IOException if the file exists but cannot be read
     */
    public static ServerConfig fromProperties(Path path) throws IOException {
        Properties props = loadDefaults();

        if (path != null) {
            if (Files.exists(path)) {
                try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
                    props.load(reader);
                }
                logger.info("Loaded configuration from {}", path);
            } else {
                logger.warn("Configuration file {} not found, using defaults", path);
            }
        }

        return fromProperties(props);
    }

    public static ServerConfig fromProperties(Properties props) {
        ListenerConfig defaultListener = ListenerConfig.builder().build();
        ServerConfig defaults = ServerConfig.builder().build();

        ListenerConfig listener = ListenerConfig.builder()
            .address(props.getProperty(ADDRESS, defaultListener.getAddress()).trim())
            .reuseAddress(parseBoolean(props, REUSE_ADDRESS, defaultListener.isReuseAddress()))
            .reusePort(parseBoolean(props, REUSE_PORT, defaultListener.isReusePort()))
            .backlog(parseInt(props, BACKLOG, defaultListener.getBacklog()))
            .build();

        ServerMode mode = defaults.getMode();
        String modeValue = props.getProperty(MODE);
        if (modeValue != null && !modeValue.isBlank()) {
            try {
                mode = ServerMode.valueOf(modeValue.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
            } catch (IllegalArgumentException ex) {
                throw new IllegalArgumentException("Unknown " + MODE + ": '" + modeValue + "'", ex);
            }
        }

        long timeoutMillis = parseInt(props, READ_TIMEOUT_MS, (int) defaults.getReadTimeout().toMillis());

        return ServerConfig.builder()
            .listener(listener)
            .mode(mode)
            .readTimeout(Duration.ofMillis(timeoutMillis))
            .build();
    }

    private static Properties loadDefaults() throws IOException {
        Properties props = new Properties();
        try (InputStream in = ServerConfigLoader.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        }
        return props;
    }

    private static boolean parseBoolean(Properties props, String key, boolean fallback) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }

        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("true")) {
            return true;
        }
        if (normalized.equals("false")) {
            return false;
        }
        throw new IllegalArgumentException(key + " must be true or false, got '" + value + "'");
    }

    private static int parseInt(Properties props, String key, int fallback) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }

        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be an integer, got '" + value + "'", ex);
        }
    }
}
