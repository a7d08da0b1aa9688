package it.unimib.datai.handlerharness.cli.testsupport;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import it.unimib.datai.handlerharness.cli.config.Config;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** Writes YAML config files the way a user would author them. */
public final class ConfigFiles {
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private ConfigFiles() {
    }

    public static Path write(Path path, Config config) {
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            YAML.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), config);
            return path;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
