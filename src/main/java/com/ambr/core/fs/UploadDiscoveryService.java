package com.ambr.core.fs;

import com.ambr.core.MissingInputException;
import com.ambr.logging.AppLogger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Locates the unshipped-orders export dropped into the upload folder.
 */
public final class UploadDiscoveryService {
    private static final Logger LOGGER = AppLogger.get();
    private static final String EXPORT_EXTENSION = ".txt";
    private static final Comparator<Path> NAME_ORDER =
        Comparator.comparing(path -> path.getFileName().toString(), String.CASE_INSENSITIVE_ORDER);

    /**
     * Returns the first {@code .txt} file (by name) directly inside {@code uploadDir}.
     *
     * @throws MissingInputException when the folder does not exist or holds no export
     */
    public Path findExport(Path uploadDir) throws IOException {
        if (uploadDir == null || !Files.isDirectory(uploadDir)) {
            throw new MissingInputException(String.valueOf(uploadDir), "Upload folder not found: " + uploadDir);
        }
        List<Path> candidates = listExports(uploadDir);
        if (candidates.isEmpty()) {
            throw new MissingInputException(uploadDir.toString(), "No " + EXPORT_EXTENSION + " export found in " + uploadDir);
        }
        Path selected = candidates.get(0);
        if (candidates.size() > 1) {
            LOGGER.info("Found %d exports in %s; using %s.".formatted(candidates.size(), uploadDir, selected.getFileName()));
        } else {
            LOGGER.info("Using export " + selected);
        }
        return selected;
    }

    public List<Path> listExports(Path uploadDir) throws IOException {
        try (Stream<Path> entries = Files.list(uploadDir)) {
            return entries
                .filter(Files::isRegularFile)
                .filter(UploadDiscoveryService::isExport)
                .sorted(NAME_ORDER)
                .collect(Collectors.toList());
        }
    }

    private static boolean isExport(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(EXPORT_EXTENSION);
    }
}
