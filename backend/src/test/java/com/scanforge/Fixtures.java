package com.scanforge;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Loads Python scanner scripts from {@code src/test/resources/fixtures}.
 */
public final class Fixtures {

    public static final String STANDALONE = "standalone_scanner.py";
    public static final String MULTI = "multi_pattern_scanner.py";
    public static final String GENERIC = "generic_scanner.py";
    public static final String STANDALONE_MULTI = "standalone_multi_scanner.py";
    public static final String BROKEN = "broken_scanner.py";

    private Fixtures() {
    }

    public static String load(String name) {
        try (InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("Missing fixture: " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
