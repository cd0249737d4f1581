package echoserver;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.net.InetSocketAddress;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ListenerConfigTest {

    @Test
    void defaultsMatchTheShippedProperties() {
        ListenerConfig config = ListenerConfig.builder().build();

        assertEquals("127.0.0.1:4444", config.getAddress());
        assertTrue(config.isReuseAddress());
        assertTrue(config.isReusePort());
        assertEquals(42, config.getBacklog());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1, Integer.MIN_VALUE})
    void rejectsNonPositiveBacklog(int backlog) {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
            () -> ListenerConfig.builder().backlog(backlog).build());

        assertTrue(ex.getMessage().contains("backlog"));
    }

    @Test
    void parsesHostAndPort() {
        InetSocketAddress address = ListenerConfig.builder().address("127.0.0.1:9000").build().socketAddress();

        assertEquals("127.0.0.1", address.getHostString());
        assertEquals(9000, address.getPort());
    }

    @Test
    void parsesBracketedIpv6() {
        InetSocketAddress address = ListenerConfig.builder().address("[::1]:8080").build().socketAddress();

        assertEquals(8080, address.getPort());
        assertFalse(address.isUnresolved());
        assertTrue(address.getAddress().isLoopbackAddress());
    }

    @ParameterizedTest
    @ValueSource(strings = {"localhost", "localhost:", ":80", "localhost:http", "localhost:70000", "localhost:-1"})
    void rejectsMalformedAddress(String address) {
        assertThrows(IllegalArgumentException.class, () -> ListenerConfig.builder().address(address).build());
    }

    @Test
    void toBuilderCopiesEveryField() {
        ListenerConfig original = ListenerConfig.builder()
            .address("127.0.0.1:1234")
            .reuseAddress(false)
            .reusePort(false)
            .backlog(7)
            .build();

        ListenerConfig copy = original.toBuilder().backlog(8).build();

        assertEquals("127.0.0.1:1234", copy.getAddress());
        assertFalse(copy.isReuseAddress());
        assertFalse(copy.isReusePort());
        assertEquals(8, copy.getBacklog());
        assertEquals(7, original.getBacklog());
    }
}
