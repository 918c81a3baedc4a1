package io.surfworks.stablebridge.ir;

/**
 * An attribute wrapping one value of a closed symbol set.
 *
 * @param <E> the enumeration of the wrapped value
 */
public interface EnumAttribute<E extends Enum<E> & SymbolicEnum> extends Attribute {

    E value();

    /**
     * Returns the attribute's name within its dialect, e.g.
     * {@code comparison_direction}.
     */
    String mnemonic();

    @Override
    default String toMlirString() {
        return "#" + dialect() + "<" + mnemonic() + " " + value().stringify() + ">";
    }
}
