package dev.fathom;

import java.util.Arrays;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Entry point for the Fathom code search service.
 *
 * <p>Supports three Spring profiles: {@code web} (REST + MCP SSE on port 8080), {@code stdio} (MCP
 * stdio transport, no web server) and {@code cli} (one-shot project management commands). Under
 * {@code cli} the JVM exits with the command's exit code once the command has run.
 */
@SpringBootApplication
public class FathomApplication {
    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(FathomApplication.class, args);
        if (Arrays.asList(context.getEnvironment().getActiveProfiles()).contains("cli")) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
