/**
 * Main application class for the dictionary engine
 *
 * @author William Callahan
 *
 * Features:
 * - Hosts the progressive generation and caching orchestrator as Spring beans
 * - Enables caching for the backend status check
 * - Loads a local .env file before the context starts
 * - Entry point for Spring Boot application
 */

package com.williamcallahan.dictionary_engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cache.annotation.EnableCaching;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

@SpringBootApplication
@EnableCaching
public class DictionaryEngineApplication {

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        loadDotEnvFile();
        SpringApplication.run(DictionaryEngineApplication.class, args);
    }

    private static void loadDotEnvFile() {
        Path envFile = Path.of(".env");
        if (!Files.exists(envFile)) {
            return;
        }
        try (InputStream is = Files.newInputStream(envFile)) {
            Properties props = new Properties();
            props.load(is);
            // Environment variables win over .env entries
            for (String key : props.stringPropertyNames()) {
                if (System.getenv(key) == null) {
                    System.setProperty(key, props.getProperty(key));
                }
            }
        } catch (IOException | SecurityException e) {
            System.err.println("[ENV] Failed to load .env file: " + e.getMessage());
        }
    }
}
