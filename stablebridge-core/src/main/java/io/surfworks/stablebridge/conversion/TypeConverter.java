package io.surfworks.stablebridge.conversion;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import io.surfworks.stablebridge.ir.Type;

/**
 * Maps types of one dialect vocabulary to another.
 *
 * <p>Implementations recurse through container types (tensors, tuples) on
 * their own; callers only see the top-level result.
 */
public interface TypeConverter {

    /**
     * Converts a single type.
     *
     * @return the converted type, or empty if the type cannot be converted
     */
    Optional<Type> convertType(Type type);

    /**
     * Converts every type of an ordered list.
     *
     * @return the converted types in the same order, or empty if any one fails
     */
    default Optional<List<Type>> convertTypes(List<Type> types) {
        List<Type> converted = new ArrayList<>(types.size());
        for (Type type : types) {
            Optional<Type> result = convertType(type);
            if (result.isEmpty()) {
                return Optional.empty();
            }
            converted.add(result.get());
        }
        return Optional.of(converted);
    }
}
