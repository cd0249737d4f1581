package echoserver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command line entry point: {@code EchoServerApp [config.properties]}.
 */
public class EchoServerApp {

    private static final Logger logger = LoggerFactory.getLogger(EchoServerApp.class);

    public static void main(String... args) throws IOException, InterruptedException {
        Path configPath = args.length > 0 ? Paths.get(args[0]) : null;

        ServerConfig config;
        try {
            config = ServerConfigLoader.fromProperties(configPath);
        } catch (IllegalArgumentException ex) {
            logger.error("Invalid configuration: {}", ex.getMessage());
            System.exit(2);
            return;
        }

        logger.info("Starting echo server with {}", config);

        EchoServer server;
        try {
            server = EchoServer.start(config);
        } catch (ListenerBindException ex) {
            logger.error("Cannot start server socket on {}", ex.getAddress(), ex);
            System.exit(1);
            return;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "echo-shutdown"));

        server.awaitTermination();
    }
}
