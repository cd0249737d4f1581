package echoserver;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ServerConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void classpathDefaultsApplyWithoutAFile() throws IOException {
        ServerConfig config = ServerConfigLoader.fromProperties((Path) null);

        assertEquals("127.0.0.1:4444", config.getListener().getAddress());
        assertTrue(config.getListener().isReuseAddress());
        assertTrue(config.getListener().isReusePort());
        assertEquals(42, config.getListener().getBacklog());
        assertEquals(ServerMode.MULTI_THREADED, config.getMode());
        assertEquals(Duration.ofMillis(500), config.getReadTimeout());
    }

    @Test
    void missingFileFallsBackToDefaults() throws IOException {
        ServerConfig config = ServerConfigLoader.fromProperties(tempDir.resolve("absent.properties"));

        assertEquals("127.0.0.1:4444", config.getListener().getAddress());
    }

    @Test
    void fileOverridesDefaults() throws IOException {
        Path file = tempDir.resolve("echo.properties");
        Files.write(file, String.join("\n",
            "echo.address=0.0.0.0:7007",
            "echo.reuse-address=false",
            "echo.reuse-port = FALSE",
            "echo.backlog=128",
            "echo.mode=single-threaded",
            "echo.read-timeout-ms=0"
        ).getBytes(StandardCharsets.UTF_8));

        ServerConfig config = ServerConfigLoader.fromProperties(file);

        assertEquals("0.0.0.0:7007", config.getListener().getAddress());
        assertFalse(config.getListener().isReuseAddress());
        assertFalse(config.getListener().isReusePort());
        assertEquals(128, config.getListener().getBacklog());
        assertEquals(ServerMode.SINGLE_THREADED, config.getMode());
        assertEquals(Duration.ZERO, config.getReadTimeout());
    }

    @Test
    void partialFileKeepsRemainingDefaults() throws IOException {
        Path file = tempDir.resolve("echo.properties");
        Files.write(file, "echo.backlog=5\n".getBytes(StandardCharsets.UTF_8));

        ServerConfig config = ServerConfigLoader.fromProperties(file);

        assertEquals(5, config.getListener().getBacklog());
        assertEquals("127.0.0.1:4444", config.getListener().getAddress());
        assertEquals(ServerMode.MULTI_THREADED, config.getMode());
    }

    @Test
    void rejectsZeroBacklog() {
        Properties props = new Properties();
        props.setProperty(ServerConfigLoader.BACKLOG, "0");

        assertThrows(IllegalArgumentException.class, () -> ServerConfigLoader.fromProperties(props));
    }

    @Test
    void rejectsNonBooleanFlag() {
        Properties props = new Properties();
        props.setProperty(ServerConfigLoader.REUSE_PORT, "yes");

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
            () -> ServerConfigLoader.fromProperties(props));
        assertTrue(ex.getMessage().contains(ServerConfigLoader.REUSE_PORT));
    }

    @Test
    void rejectsUnknownMode() {
        Properties props = new Properties();
        props.setProperty(ServerConfigLoader.MODE, "event-loop");

        assertThrows(IllegalArgumentException.class, () -> ServerConfigLoader.fromProperties(props));
    }

    @Test
    void rejectsNegativeReadTimeout() {
        Properties props = new Properties();
        props.setProperty(ServerConfigLoader.READ_TIMEOUT_MS, "-1");

        assertThrows(IllegalArgumentException.class, () -> ServerConfigLoader.fromProperties(props));
    }
}
