package com.dish.curation.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Coerces list-valued fields stored with inconsistent historical encodings into a
 * canonical list of strings.
 *
 * <p>Accepted forms for the same logical field:</p>
 * <ul>
 *   <li>a real array ({@link JsonNode} array, {@link Collection} or {@code Object[]})</li>
 *   <li>a JSON-encoded array inside a string, e.g. {@code "[\"rice\",\"pork\"]"}</li>
 *   <li>a comma-separated string, e.g. {@code "rice, pork"}</li>
 * </ul>
 * Entries are trimmed, blanks are dropped and order is kept. Null, blank and
 * unparseable-but-empty input yields an empty list.
 */
public final class ListFieldNormalizer {
    private static final Logger log = LoggerFactory.getLogger(ListFieldNormalizer.class);

    private final ObjectMapper objectMapper;

    public ListFieldNormalizer() {
        this(new ObjectMapper());
    }

    public ListFieldNormalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<String> normalize(Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof JsonNode node) {
            return fromNode(node);
        }
        if (value instanceof Collection<?> collection) {
            return fromElements(collection);
        }
        if (value instanceof Object[] array) {
            return fromElements(List.of(array));
        }
        return fromString(String.valueOf(value));
    }

    private List<String> fromNode(JsonNode node) {
        if (node.isNull() || node.isMissingNode()) {
            return List.of();
        }
        if (node.isArray()) {
            List<String> out = new ArrayList<>();
            for (JsonNode element : node) {
                if (!element.isNull()) {
                    addTrimmed(out, element.isTextual() ? element.textValue() : element.toString());
                }
            }
            return List.copyOf(out);
        }
        return fromString(node.isTextual() ? node.textValue() : node.toString());
    }

    private List<String> fromElements(Collection<?> elements) {
        List<String> out = new ArrayList<>();
        for (Object element : elements) {
            if (element != null) {
                addTrimmed(out, String.valueOf(element));
            }
        }
        return List.copyOf(out);
    }

    private List<String> fromString(String raw) {
        String s = raw.trim();
        if (s.isEmpty()) {
            return List.of();
        }
        if (s.startsWith("[")) {
            try {
                JsonNode parsed = objectMapper.readTree(s);
                if (parsed.isArray()) {
                    return fromNode(parsed);
                }
            } catch (JsonProcessingException e) {
                log.debug("List field looks like JSON but does not parse, splitting on commas: {}", e.getOriginalMessage());
            }
            s = s.substring(1, s.endsWith("]") ? s.length() - 1 : s.length());
        }
        List<String> out = new ArrayList<>();
        for (String part : s.split(",")) {
            addTrimmed(out, stripQuotes(part.trim()));
        }
        return List.copyOf(out);
    }

    private static String stripQuotes(String s) {
        if (s.length() >= 2 && (s.startsWith("\"") && s.endsWith("\"") || s.startsWith("'") && s.endsWith("'"))) {
            return s.substring(1, s.length() - 1);
        }
        return s;
    }

    private static void addTrimmed(List<String> out, String value) {
        String trimmed = value.trim();
        if (!trimmed.isEmpty()) {
            out.add(trimmed);
        }
    }
}
