/**
 * Main application class for the link preview service
 *
 * Features:
 * - Loads a local .env file into system properties before startup
 * - Binds host and port from the HOST and PORT environment variables
 * - Logs the listening address once the context is ready
 * - Entry point for Spring Boot application
 */

package net.linkpreview;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.core.env.Environment;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

@SpringBootApplication
public class LinkPreviewApplication implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(LinkPreviewApplication.class);
    private static final String DEFAULT_HOST = "127.0.0.1";
    private static final String DEFAULT_PORT = "8080";

    private final Environment environment;

    public LinkPreviewApplication(Environment environment) {
        this.environment = environment;
    }

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        loadDotEnvFile(Paths.get(".env"));
        disableNettyUnsafeAccess();
        SpringApplication.run(LinkPreviewApplication.class, args);
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("Server running at {}", listenUrl());
    }

    String listenUrl() {
        String host = environment.getProperty("server.address", DEFAULT_HOST);
        String port = environment.getProperty("local.server.port", environment.getProperty("server.port", DEFAULT_PORT));
        return "http://" + host + ":" + port;
    }

    private static void disableNettyUnsafeAccess() {
        if (System.getProperty("io.netty.noUnsafe") == null) {
            System.setProperty("io.netty.noUnsafe", "true");
        }
    }

    static void loadDotEnvFile(Path envFile) {
        if (!Files.exists(envFile)) {
            return;
        }
        try {
            Properties props = new Properties();
            try (InputStream is = Files.newInputStream(envFile)) {
                props.load(is);
            }
            // Real environment variables take precedence over .env entries
            for (String key : props.stringPropertyNames()) {
                if (System.getenv(key) == null) {
                    System.setProperty(key, props.getProperty(key));
                }
            }
        } catch (IOException | IllegalArgumentException | SecurityException e) {
            log.warn("Failed to load .env file; aborting startup", e);
            throw new IllegalStateException("Failed to load .env file", e);
        }
    }
}
