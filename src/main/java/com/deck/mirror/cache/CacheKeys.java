package com.deck.mirror.cache;

import org.apache.commons.codec.digest.DigestUtils;

import java.util.List;
import java.util.Objects;

/**
 * Derives content-addressed cache keys.
 *
 * <p>A key is a pure function of the model identifier, the full prompt (or purpose)
 * template and the ordered, whitespace-normalized inputs. Changing the model or a
 * single character of the template therefore always produces a different key.</p>
 */
public final class CacheKeys {

    private static final char UNIT_SEPARATOR = '\u001f';

    private CacheKeys() {
    }

    public static String derive(String modelId, String template, String... inputs) {
        return derive(modelId, template, List.of(inputs));
    }

    public static String derive(String modelId, String template, List<String> inputs) {
        Objects.requireNonNull(modelId, "modelId is required");
        Objects.requireNonNull(template, "template is required");
        StringBuilder material = new StringBuilder();
        material.append(modelId).append(UNIT_SEPARATOR);
        material.append(DigestUtils.sha256Hex(template));
        for (String input : inputs) {
            material.append(UNIT_SEPARATOR).append(normalize(input));
        }
        return DigestUtils.sha256Hex(material.toString());
    }

    static String normalize(String input) {
        return input == null ? "" : input.strip();
    }
}
