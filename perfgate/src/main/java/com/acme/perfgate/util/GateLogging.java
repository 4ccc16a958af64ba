package com.acme.perfgate.util;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.LogManager;

/**
 * Installs the bundled single-line console format unless the JVM was started with an
 * explicit {@code java.util.logging.config.file}.
 */
public final class GateLogging {
    private static final String RESOURCE = "/perfgate-logging.properties";

    private GateLogging() {
    }

    public static void install() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = GateLogging.class.getResourceAsStream(RESOURCE)) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("perfgate: failed to load " + RESOURCE + ": " + e.getMessage());
        }
    }
}
