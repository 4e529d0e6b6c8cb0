package io.github.cobfuscator;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

public final class Util {

    private Util() {
    }

    public static Map<String, String> createMap(Object... parts) {
        Map<String, String> map = new HashMap<>();
        for (int i = 0; i < parts.length; i += 2) {
            map.put(String.valueOf(parts[i]), String.valueOf(parts[i + 1]));
        }
        return map;
    }

    /** Replaces every {@code $name} in {@code template} with its value from {@code tokens}. */
    public static String dynamicFormat(String template, Map<String, String> tokens) {
        String result = template;
        for (Map.Entry<String, String> token : tokens.entrySet()) {
            result = result.replace("$" + token.getKey(), token.getValue());
        }
        return result;
    }

    public static String readResource(String path) {
        try (InputStream in = Util.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new InternalInvariantException("missing resource " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read resource " + path, e);
        }
    }
}
