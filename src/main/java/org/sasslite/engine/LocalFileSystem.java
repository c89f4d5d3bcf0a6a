package org.sasslite.engine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads imported files from the local disk as UTF-8.
 */
public final class LocalFileSystem implements SourceFileSystem {

    @Override
    public boolean isReadable(String path) {
        Path file = Path.of(path);
        return Files.isRegularFile(file) && Files.isReadable(file);
    }

    @Override
    public String read(String path) throws IOException {
        return Files.readString(Path.of(path), StandardCharsets.UTF_8);
    }

    @Override
    public String resolve(String directory, String name) {
        return Path.of(directory).resolve(name).toString();
    }
}
