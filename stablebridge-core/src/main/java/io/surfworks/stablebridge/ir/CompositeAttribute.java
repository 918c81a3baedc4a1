package io.surfworks.stablebridge.ir;

import java.util.Map;

/**
 * An attribute that is a fixed-arity record of named fields.
 */
public interface CompositeAttribute extends Attribute {

    /**
     * Returns the fields of this record by name, in schema order.
     *
     * <p>Values are {@code Long} for scalar fields and {@code List<Long>} for
     * list fields.
     */
    Map<String, Object> fields();

    /**
     * Renders the fields as {@code name = value} pairs in schema order.
     */
    static String formatFields(Map<String, Object> fields) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, Object> e : fields.entrySet()) {
            if (sb.length() > 0) sb.append(", ");
            sb.append(e.getKey()).append(" = ").append(e.getValue());
        }
        return sb.toString();
    }
}
