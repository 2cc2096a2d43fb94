package io.github.twinview.util;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Properties;

/** File writes that never leave a half-written settings file behind. */
public final class AtomicWrites {
    private AtomicWrites() {}

    /**
     * Writes {@code properties} to a temporary file next to {@code target} and moves it into place, atomically where
     * the file system supports it. Missing parent directories are created.
     */
    public static void saveProperties(Path target, Properties properties, String comment) throws IOException {
        final Path dir = target.toAbsolutePath().getParent();
        Files.createDirectories(dir);

        var writer = new StringWriter();
        properties.store(writer, comment);

        final Path temp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
        try {
            Files.writeString(temp, writer.toString(), StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
    }
}
