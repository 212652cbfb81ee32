package health.assist.llm;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public final class FieldCoercion {
    private FieldCoercion() {
    }

    public static String text(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return "";
        }
        if (node.isValueNode()) {
            return node.asText().trim();
        }
        return node.toString().trim();
    }

    public static String lowerText(JsonNode node) {
        return text(node).toLowerCase(Locale.ROOT);
    }

    public static List<String> stringList(JsonNode node, int limit) {
        List<String> out = new ArrayList<>();
        if (node == null) {
            return out;
        }
        if (node.isArray()) {
            for (JsonNode entry : node) {
                String value = text(entry);
                if (value.isEmpty()) {
                    continue;
                }
                out.add(value);
                if (out.size() == limit) {
                    break;
                }
            }
            return out;
        }
        if (node.isTextual() && !node.asText().isBlank()) {
            out.add(node.asText().trim());
        }
        return out;
    }

    public static boolean bool(JsonNode node, boolean defaultValue) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return defaultValue;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber()) {
            return node.doubleValue() != 0.0;
        }
        if (node.isTextual()) {
            String value = node.asText().trim().toLowerCase(Locale.ROOT);
            if (value.equals("true") || value.equals("yes")) {
                return true;
            }
            if (value.equals("false") || value.equals("no") || value.isEmpty()) {
                return false;
            }
        }
        return defaultValue;
    }

    /**
     * Numeric value of a number or numeric string, clamped to [0, 1]. Anything
     * unparseable (or not finite) yields {@code defaultValue}.
     */
    public static double probability(JsonNode node, double defaultValue) {
        double value = defaultValue;
        if (node != null && node.isNumber()) {
            value = node.doubleValue();
        } else if (node != null && node.isBoolean()) {
            value = node.booleanValue() ? 1.0 : 0.0;
        } else if (node != null && node.isTextual()) {
            try {
                value = Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                value = defaultValue;
            }
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            value = defaultValue;
        }
        return Math.max(0.0, Math.min(value, 1.0));
    }
}
