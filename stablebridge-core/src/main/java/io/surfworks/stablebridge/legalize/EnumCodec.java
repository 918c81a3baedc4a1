package io.surfworks.stablebridge.legalize;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

import io.surfworks.stablebridge.ir.Attribute;
import io.surfworks.stablebridge.ir.EnumAttribute;
import io.surfworks.stablebridge.ir.SymbolicEnum;

/**
 * Converts the values of one enumeration into another by canonical name.
 *
 * <p>The source value is stringified and the resulting symbol is symbolized
 * in the target enumeration. A source symbol the target does not know has no
 * conversion: the two vocabularies have drifted apart.
 *
 * @param <S> source enumeration
 * @param <T> target enumeration
 */
public final class EnumCodec<S extends Enum<S> & SymbolicEnum, T extends Enum<T> & SymbolicEnum> {

    private final String name;
    private final Class<S> sourceType;
    private final Function<String, Optional<T>> symbolize;
    private final Function<T, ? extends Attribute> targetAttribute;

    /**
     * Creates a codec.
     *
     * @param name attribute mnemonic shared by both dialects, e.g. {@code precision}
     * @param sourceType the source enumeration
     * @param symbolize resolves a canonical symbol in the target enumeration
     * @param targetAttribute wraps a target value into the target dialect's attribute
     */
    public EnumCodec(String name, Class<S> sourceType, Function<String, Optional<T>> symbolize,
                     Function<T, ? extends Attribute> targetAttribute) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.sourceType = Objects.requireNonNull(sourceType, "sourceType cannot be null");
        this.symbolize = Objects.requireNonNull(symbolize, "symbolize cannot be null");
        this.targetAttribute = Objects.requireNonNull(targetAttribute, "targetAttribute cannot be null");
    }

    public String name() {
        return name;
    }

    /**
     * Converts a source value.
     *
     * @return the same-named target value, or empty if there is none
     */
    public Optional<T> convert(S value) {
        return symbolize.apply(value.stringify());
    }

    /**
     * Converts a source enum attribute into the target dialect's attribute.
     *
     * @return the target attribute, or empty if the value has no counterpart
     */
    public Optional<Attribute> convertAttribute(EnumAttribute<S> attr) {
        return convert(attr.value()).map(value -> targetAttribute.apply(value));
    }

    /**
     * Returns the source values without a same-named target value, in
     * declaration order.
     */
    public List<S> unmappedSymbols() {
        List<S> unmapped = new ArrayList<>();
        for (S value : sourceType.getEnumConstants()) {
            if (convert(value).isEmpty()) {
                unmapped.add(value);
            }
        }
        return unmapped;
    }

    @Override
    public String toString() {
        return "EnumCodec[" + name + "]";
    }
}
