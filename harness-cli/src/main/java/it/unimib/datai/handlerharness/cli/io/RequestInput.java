package it.unimib.datai.handlerharness.cli.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a request body given as inline text, {@code @file} or {@code @-} for stdin.
 */
public final class RequestInput {
    private RequestInput() {}

    public static String read(String data, InputStream stdin) {
        if (data == null || !data.startsWith("@")) {
            return data;
        }
        String ref = data.substring(1);
        try {
            if (ref.equals("-")) {
                return new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
            }
            return Files.readString(Path.of(ref));
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read input: " + data, e);
        }
    }
}
