package io.github.jbellis.ticketsync.util;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Properties;

public class AtomicWrites {
    /**
     * Overwrites the content of a file with the provided text data.
     * <p>
     * The text is written to a temporary sibling file which is then moved over the target,
     * atomically when the filesystem supports it.
     *
     * @param targetPath the path to the target file that will be overwritten.
     * @param content    the text content to write.
     * @throws IOException if an I/O error occurs during writing or moving the file.
     */
    public static void atomicOverwrite(Path targetPath, String content) throws IOException {
        atomicOverwrite(targetPath, content.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Binary variant of {@link #atomicOverwrite(Path, String)}, used for downloaded attachments.
     */
    public static void atomicOverwrite(Path targetPath, byte[] content) throws IOException {
        var parent = targetPath.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path tempFile = Files.createTempFile(parent, "temp-", ".tmp");

        try {
            Files.write(tempFile, content);

            try {
                Files.move(tempFile, targetPath,
                           StandardCopyOption.ATOMIC_MOVE,
                           StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tempFile, targetPath, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            Files.deleteIfExists(tempFile);
            throw e;
        }
    }

    /**
     * Atomically saves a Properties object to a file, creating parent directories as needed.
     *
     * @param path the path to the target file
     * @param properties the Properties to save
     * @param comment optional comment for the properties file
     * @throws IOException if an I/O error occurs
     */
    public static void atomicSaveProperties(Path path, Properties properties, String comment) throws IOException {
        Files.createDirectories(path.getParent());

        StringWriter writer = new StringWriter();
        properties.store(writer, comment);
        atomicOverwrite(path, writer.toString());
    }
}
