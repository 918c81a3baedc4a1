package io.surfworks.stablebridge.ir;

import java.util.Optional;

/**
 * An enumeration whose values have a canonical textual symbol.
 *
 * <p>{@link #stringify()} and {@link #symbolize(Class, String)} form the pair
 * used to move enum values between dialect vocabularies by name.
 */
public interface SymbolicEnum {

    /**
     * Returns the canonical symbol of this value, e.g. {@code "EQ"}.
     */
    String stringify();

    /**
     * Resolves a canonical symbol in the given enumeration.
     *
     * @param type the enum class to search
     * @param symbol the canonical symbol
     * @return the matching value, or empty if the enumeration has none
     */
    static <E extends Enum<E> & SymbolicEnum> Optional<E> symbolize(Class<E> type, String symbol) {
        for (E value : type.getEnumConstants()) {
            if (value.stringify().equals(symbol)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
