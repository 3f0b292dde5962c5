package com.ambr.core.report;

import com.ambr.core.model.OrderRecord;
import com.ambr.logging.AppLogger;

import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Adds a {@code purchase-date-local} column rendering the export's ISO-8601 purchase date in the
 * reporting zone.
 */
public final class TimezoneAnnotator {
    private static final Logger LOGGER = AppLogger.get();

    public static final String SOURCE_COLUMN = "purchase-date";
    public static final String TARGET_COLUMN = "purchase-date-local";

    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");

    private final ZoneId zone;

    public TimezoneAnnotator(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    public List<OrderRecord> annotate(List<OrderRecord> orders) {
        List<OrderRecord> annotated = new ArrayList<>(orders.size());
        int unparsed = 0;
        for (OrderRecord order : orders) {
            String local = toLocal(order.attribute(SOURCE_COLUMN));
            if (local.isEmpty()) {
                unparsed++;
            }
            annotated.add(order.withAttributes(Map.of(TARGET_COLUMN, local)));
        }
        if (unparsed > 0) {
            int count = unparsed;
            LOGGER.fine(() -> "%d order(s) had no parseable purchase date.".formatted(count));
        }
        return annotated;
    }

    String toLocal(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        try {
            return OffsetDateTime.parse(raw.strip()).atZoneSameInstant(zone).format(FORMAT);
        } catch (DateTimeParseException ex) {
            return "";
        }
    }
}
