package com.pgcrond.app;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.OptionalLong;
import java.util.logging.Logger;

/**
 * The daemon's PID file: a single line holding a decimal process ID.
 */
public class PidFile {
    private static final Logger logger = Logger.getLogger(PidFile.class.getName());

    private final Path path;

    public PidFile(Path path) {
        this.path = path;
    }

    public Path getPath() {
        return path;
    }

    /**
     * Read the recorded PID.
     *
     * @return the PID, or empty if the file is missing or does not hold a number
     * @throws IOException if the file exists but cannot be read
     */
    public OptionalLong read() throws IOException {
        String content;
        try {
            content = Files.readString(path, StandardCharsets.US_ASCII).trim();
        } catch (NoSuchFileException e) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(content));
        } catch (NumberFormatException e) {
            logger.warning("PID file " + path + " does not contain a process ID: '" + content + "'");
            return OptionalLong.empty();
        }
    }

    /**
     * Record a PID, replacing any previous content.
     */
    public void write(long pid) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(temp, pid + "\n", StandardCharsets.US_ASCII);
        Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    /**
     * Delete the file if it exists.
     *
     * @return true if a file was deleted
     */
    public boolean delete() throws IOException {
        return Files.deleteIfExists(path);
    }

    public boolean exists() {
        return Files.exists(path);
    }

    @Override
    public String toString() {
        return path.toString();
    }
}
