package com.outbreaksentinel.service;

import com.outbreaksentinel.service.http.HttpClientFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.function.Consumer;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        configureLogging();
        RuntimeSettings settings = resolveSettings(System.getenv(), LOGGER::warning);
        LOGGER.info("Starting with config " + settings.configDir() + ", state " + settings.stateDir());

        ServiceRuntime runtime = ServiceRuntime.assemble(
                settings.configDir(),
                settings.stateDir(),
                settings.port(),
                Clock.systemUTC(),
                HttpClientFactory.create(Duration.ofSeconds(5))
        );
        runtime.start();

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            runtime.stop();
            shutdownLatch.countDown();
        }));

        shutdownLatch.await();
    }

    static RuntimeSettings resolveSettings(Map<String, String> env, Consumer<String> warn) {
        Path configDir = Path.of(env.getOrDefault("SURVEILLANCE_CONFIG_DIR", "config"));
        Path stateDir = Path.of(env.getOrDefault("SURVEILLANCE_STATE_DIR", "state"));
        String portRaw = env.getOrDefault("SURVEILLANCE_PORT", "8080");
        int port;
        try {
            port = Integer.parseInt(portRaw.trim());
        } catch (NumberFormatException e) {
            warn.accept("Unknown SURVEILLANCE_PORT=" + portRaw + ", defaulting to 8080");
            port = 8080;
        }
        if (port < 0 || port > 65535) {
            warn.accept("SURVEILLANCE_PORT=" + portRaw + " is out of range, defaulting to 8080");
            port = 8080;
        }
        return new RuntimeSettings(configDir, stateDir, port);
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOGGER.warning("Failed loading logging.properties: " + e.getMessage());
        }
    }

    record RuntimeSettings(Path configDir, Path stateDir, int port) {
    }
}
