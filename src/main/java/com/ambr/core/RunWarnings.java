package com.ambr.core;

import com.ambr.logging.AppLogger;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Logger;

/**
 * Collects the degraded-path warnings of a run so they can be shown next to the final summary.
 * Every warning is logged when it is recorded.
 */
public final class RunWarnings {
    private static final Logger LOGGER = AppLogger.get();

    private final List<String> warnings = new CopyOnWriteArrayList<>();

    public void add(String warning) {
        if (warning == null || warning.isBlank()) {
            return;
        }
        LOGGER.warning(warning);
        warnings.add(warning);
    }

    public List<String> asList() {
        return List.copyOf(warnings);
    }

    public boolean isEmpty() {
        return warnings.isEmpty();
    }

    public int size() {
        return warnings.size();
    }
}
