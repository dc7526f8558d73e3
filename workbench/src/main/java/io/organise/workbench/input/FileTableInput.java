package io.organise.workbench.input;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

public class FileTableInput implements TableInput {
    private final Path file;

    public FileTableInput(Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    public Path file() { return file; }

    @Override
    public InputStream open() throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(file.toString(), null, "Input file does not exist");
        }
        return Files.newInputStream(file);
    }

    @Override
    public String describe() { return file.toString(); }
}
