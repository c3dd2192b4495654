package com.example.sfera.cache;

import org.apache.commons.codec.digest.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Deterministic cache keys for tool/API calls.
 *
 * <p>Positional arguments keep their order, named arguments are sorted by name, and the
 * encoded form is hashed to a fixed-length MD5 hex string. Every value is written as
 * {@code <length>:<text>} and {@code null} as {@code ~}, so two distinct calls only share a
 * key through a hash coincidence. Not meant to be collision-proof against an adversary.</p>
 */
public final class CacheKeys {

    private static final String NULL_TOKEN = "~";

    private CacheKeys() {
    }

    public static String of(Object... args) {
        return of(Arrays.asList(args), Map.of());
    }

    public static String of(List<?> args, Map<String, ?> namedArgs) {
        StringBuilder sb = new StringBuilder("P").append(args.size()).append('[');
        for (Object a : args) {
            append(sb, a);
        }
        sb.append("]N").append(namedArgs.size()).append('[');
        for (Map.Entry<String, ?> e : new TreeMap<>(namedArgs).entrySet()) {
            append(sb, e.getKey());
            append(sb, e.getValue());
        }
        sb.append(']');
        return DigestUtils.md5Hex(sb.toString().getBytes(StandardCharsets.UTF_8));
    }

    private static void append(StringBuilder sb, Object value) {
        if (value == null) {
            sb.append(NULL_TOKEN);
            return;
        }
        String text = String.valueOf(value);
        sb.append(text.length()).append(':').append(text);
    }
}
