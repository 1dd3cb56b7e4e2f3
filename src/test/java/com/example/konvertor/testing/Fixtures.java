package com.example.konvertor.testing;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

/**
 * Loads files from {@code src/test/resources/fixtures} and builds small tables for tests.
 */
public final class Fixtures {

    public static final List<String> HEADER = List.of("Názov", "Účet MD", "Účet Dal", "Stred.", "Zák.", "Činn.");

    private Fixtures() {
    }

    public static byte[] bytes(String name) {
        try (InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("Missing fixture " + name);
            }
            return in.readAllBytes();
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    public static String text(String name) {
        return new String(bytes(name), StandardCharsets.UTF_8);
    }

    public static List<String> row(String... cells) {
        return Arrays.asList(cells);
    }
}
