/**
 * Main application class for the profile media service
 *
 * Features:
 * - Loads a local .env file into system properties before startup
 * - Entry point for Spring Boot application
 */

package net.profilemedia;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ProfileMediaApplication {

    private static final Logger log = LoggerFactory.getLogger(ProfileMediaApplication.class);

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        loadDotEnvFile(Paths.get(".env"));
        SpringApplication.run(ProfileMediaApplication.class, args);
    }

    static void loadDotEnvFile(Path envFile) {
        if (!Files.exists(envFile)) {
            return;
        }
        try (InputStream is = Files.newInputStream(envFile)) {
            Properties props = new Properties();
            props.load(is);
            // Real environment variables win over .env entries
            for (String key : props.stringPropertyNames()) {
                if (System.getenv(key) == null && System.getProperty(key) == null) {
                    System.setProperty(key, props.getProperty(key));
                }
            }
            log.info("Loaded {} entries from {}", props.size(), envFile);
        } catch (IOException | SecurityException e) {
            log.warn("Failed to load .env file; aborting startup", e);
            throw new IllegalStateException("Failed to load .env file", e);
        }
    }
}
