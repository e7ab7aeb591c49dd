package org.posts.validation;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.util.Iterator;
import java.util.Map;

/**
 * Renders a JSON value the way validation messages quote it:
 * {@code 'text'}, {@code 32}, {@code True}, {@code None}, {@code [1, 2]}, {@code {'k': 'v'}}.
 */
public final class JsonValueRenderer {

    private JsonValueRenderer() {
    }

    public static String render(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return "None";
        if (node.isTextual()) return quote(node.textValue());
        if (node.isBoolean()) return node.booleanValue() ? "True" : "False";
        if (node.isFloatingPointNumber()) return renderFloat(node.doubleValue());
        if (node.isNumber()) return node.asText();
        if (node.isArray()) {
            StringBuilder sb = new StringBuilder("[");
            Iterator<JsonNode> it = node.elements();
            while (it.hasNext()) {
                sb.append(render(it.next()));
                if (it.hasNext()) sb.append(", ");
            }
            return sb.append(']').toString();
        }
        if (node.isObject()) {
            StringBuilder sb = new StringBuilder("{");
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> field = it.next();
                sb.append(quote(field.getKey())).append(": ").append(render(field.getValue()));
                if (it.hasNext()) sb.append(", ");
            }
            return sb.append('}').toString();
        }
        return node.toString();
    }

    /**
     * Float repr: {@code inf}, {@code nan}, {@code 10000000000.0}, {@code 1.5e+20}, {@code 1e-05}.
     * Positional notation while the decimal exponent is in [-4, 16).
     */
    static String renderFloat(double value) {
        if (Double.isNaN(value)) return "nan";
        if (Double.isInfinite(value)) return value > 0 ? "inf" : "-inf";
        if (value == 0.0) return (1.0 / value < 0) ? "-0.0" : "0.0";

        String sign = value < 0 ? "-" : "";
        BigDecimal decimal = new BigDecimal(Double.toString(Math.abs(value))).stripTrailingZeros();
        String digits = decimal.unscaledValue().toString();
        int exponent = digits.length() - 1 - decimal.scale();

        if (exponent < -4 || exponent >= 16) {
            StringBuilder sb = new StringBuilder(sign).append(digits.charAt(0));
            if (digits.length() > 1) sb.append('.').append(digits, 1, digits.length());
            sb.append('e').append(exponent < 0 ? '-' : '+');
            int abs = Math.abs(exponent);
            if (abs < 10) sb.append('0');
            return sb.append(abs).toString();
        }

        String plain = decimal.toPlainString();
        return sign + (plain.indexOf('.') >= 0 ? plain : plain + ".0");
    }

    static String quote(String text) {
        // guillemets doubles seulement si le texte contient ' mais pas "
        char delimiter = text.indexOf('\'') >= 0 && text.indexOf('"') < 0 ? '"' : '\'';
        StringBuilder sb = new StringBuilder().append(delimiter);
        for (char c : text.toCharArray()) {
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c == delimiter) sb.append('\\');
                    sb.append(c);
                }
            }
        }
        return sb.append(delimiter).toString();
    }
}
