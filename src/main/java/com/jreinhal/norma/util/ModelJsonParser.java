package com.jreinhal.norma.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient extraction of JSON from model output. Models wrap payloads in code fences,
 * prepend reasoning prose or append commentary; all of that is tolerated here and
 * nothing is ever thrown to the caller.
 */
public final class ModelJsonParser {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Pattern FENCE = Pattern.compile("```(?:json|JSON)?\\s*(.*?)```", Pattern.DOTALL);

    private ModelJsonParser() {
    }

    public static Optional<JsonNode> parseObject(String raw) {
        return parse(raw, '{', '}').filter(JsonNode::isObject);
    }

    public static Optional<JsonNode> parseArray(String raw) {
        return parse(raw, '[', ']').filter(JsonNode::isArray);
    }

    private static Optional<JsonNode> parse(String raw, char open, char close) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        List<String> candidates = new ArrayList<>();
        Matcher fence = FENCE.matcher(raw);
        while (fence.find()) {
            candidates.add(fence.group(1));
        }
        candidates.add(raw);
        for (String candidate : candidates) {
            String block = outermostBlock(candidate, open, close);
            if (block == null) {
                continue;
            }
            try {
                return Optional.of(MAPPER.readTree(block));
            } catch (Exception e) {
                // next candidate
            }
        }
        return Optional.empty();
    }

    private static String outermostBlock(String text, char open, char close) {
        int start = text.indexOf(open);
        int end = text.lastIndexOf(close);
        if (start < 0 || end <= start) {
            return null;
        }
        return text.substring(start, end + 1);
    }

    public static String text(JsonNode node, String field, String defaultValue) {
        if (node == null) {
            return defaultValue;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        if (value.isValueNode()) {
            String text = value.asText();
            return text.isBlank() ? defaultValue : text.trim();
        }
        return value.toString();
    }

    public static double number(JsonNode node, String field, double defaultValue) {
        if (node == null || node.get(field) == null || node.get(field).isNull()) {
            return defaultValue;
        }
        JsonNode value = node.get(field);
        double parsed;
        if (value.isNumber()) {
            parsed = value.asDouble();
        } else {
            try {
                parsed = Double.parseDouble(value.asText().trim().replace(',', '.'));
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return Double.isFinite(parsed) ? parsed : defaultValue;
    }

    public static boolean bool(JsonNode node, String field, boolean defaultValue) {
        if (node == null || node.get(field) == null || node.get(field).isNull()) {
            return defaultValue;
        }
        JsonNode value = node.get(field);
        if (value.isBoolean()) {
            return value.asBoolean();
        }
        String text = value.asText().trim().toLowerCase();
        if (text.equals("true") || text.equals("si") || text.equals("sì") || text.equals("yes")) {
            return true;
        }
        if (text.equals("false") || text.equals("no")) {
            return false;
        }
        return defaultValue;
    }

    public static List<String> stringList(JsonNode node, String field) {
        List<String> values = new ArrayList<>();
        if (node == null) {
            return values;
        }
        JsonNode array = node.get(field);
        if (array == null || array.isNull()) {
            return values;
        }
        if (!array.isArray()) {
            String single = array.asText();
            if (!single.isBlank()) {
                values.add(single.trim());
            }
            return values;
        }
        for (JsonNode item : array) {
            String text = item.isValueNode() ? item.asText() : item.toString();
            if (!text.isBlank()) {
                values.add(text.trim());
            }
        }
        return values;
    }
}
