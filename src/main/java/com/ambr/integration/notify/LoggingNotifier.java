package com.ambr.integration.notify;

import com.ambr.core.report.Notifier;
import com.ambr.logging.AppLogger;

import java.util.logging.Logger;

/**
 * Used when no webhook is configured: the summary only goes to the application log.
 */
public class LoggingNotifier implements Notifier {
    private static final Logger LOGGER = AppLogger.get();

    @Override
    public void send(String title, String summary) {
        LOGGER.info(title + System.lineSeparator() + summary);
    }
}
