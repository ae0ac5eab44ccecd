package dev.scriptorium;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the Scriptorium retrieval service.
 *
 * <p>Exposes no network transport; {@link dev.scriptorium.api.RetrievalApi} is the facade other
 * components call.
 */
@SpringBootApplication
public class ScriptoriumApplication {
    public static void main(String[] args) {
        SpringApplication.run(ScriptoriumApplication.class, args);
    }
}
