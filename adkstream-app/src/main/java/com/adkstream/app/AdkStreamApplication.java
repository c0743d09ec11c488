package com.adkstream.app;

import com.adkstream.common.logging.LogLevel;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

import java.util.Map;

/**
 * ADK stream protocol server entry point.
 */
@SpringBootApplication
@ComponentScan(basePackages = "com.adkstream")
public class AdkStreamApplication {

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(AdkStreamApplication.class);
        app.setDefaultProperties(loggingDefaults(System.getenv()));
        app.run(args);
    }

    /**
     * Log levels derived from {@code LOG_LEVEL}. Explicit {@code logging.level.*}
     * properties still win.
     */
    static Map<String, Object> loggingDefaults(Map<String, String> env) {
        String level = LogLevel.fromEnvironment(env).toSlf4jLevel();
        return Map.of(
                "logging.level.com.adkstream", level,
                "logging.level.adkstream", level);
    }
}
