package com.ambr.cli;

import com.ambr.config.ConfigService;
import com.ambr.config.PipelineConfig;
import com.ambr.core.MissingInputException;
import com.ambr.logging.AppLogger;
import com.ambr.pipeline.ReconciliationPipeline;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command-line entry point: runs one reconciliation of the export in the upload folder.
 * <p>
 * Options override the configured paths: {@code --upload DIR}, {@code --output DIR},
 * {@code --old-master FILE}, {@code --new-master FILE}. Also accepted as {@code --option=value}.
 */
public final class UnshippedOrdersTool {
    private static final Logger LOGGER = AppLogger.get();

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final Map<String, String> OPTION_KEYS = Map.of(
        "--upload", ConfigService.UPLOAD_DIR,
        "--output", ConfigService.OUTPUT_DIR,
        "--old-master", ConfigService.OLD_MASTER,
        "--new-master", ConfigService.NEW_MASTER
    );

    private UnshippedOrdersTool() {}

    public static void main(String[] args) {
        int code = run(args, ConfigService::new);
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    static int run(String[] args, Supplier<ConfigService> configServices) {
        Map<String, String> overrides;
        try {
            overrides = parseArgs(args);
        } catch (IllegalArgumentException ex) {
            LOGGER.severe(ex.getMessage());
            LOGGER.severe("Usage: UnshippedOrdersTool [--upload DIR] [--output DIR] [--old-master FILE] [--new-master FILE]");
            return EXIT_USAGE;
        }
        try {
            PipelineConfig config = configServices.get().load(overrides);
            ReconciliationPipeline.fromConfig(config).run();
            return EXIT_OK;
        } catch (MissingInputException ex) {
            LOGGER.severe("Missing input (%s): %s".formatted(ex.getResource(), ex.getMessage()));
            return EXIT_FAILURE;
        } catch (IOException ex) {
            LOGGER.log(Level.SEVERE, "Run failed: " + ex.getMessage(), ex);
            return EXIT_FAILURE;
        } catch (IllegalArgumentException | UncheckedIOException ex) {
            LOGGER.severe("Invalid configuration: " + ex.getMessage());
            return EXIT_FAILURE;
        }
    }

    /**
     * Translates command-line options into configuration overrides.
     *
     * @throws IllegalArgumentException on an unknown option or a missing value
     */
    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> overrides = new LinkedHashMap<>();
        if (args == null) {
            return overrides;
        }
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg == null || arg.isBlank()) continue;
            String option = arg.trim();
            String value = null;
            int eq = option.indexOf('=');
            if (eq > 0) {
                value = option.substring(eq + 1);
                option = option.substring(0, eq);
            }
            String key = OPTION_KEYS.get(option);
            if (key == null) {
                throw new IllegalArgumentException("Unknown option: " + option);
            }
            if (value == null) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("Missing value for " + option);
                }
                value = args[++i];
            }
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException("Missing value for " + option);
            }
            overrides.put(key, value.trim());
        }
        return overrides;
    }
}
