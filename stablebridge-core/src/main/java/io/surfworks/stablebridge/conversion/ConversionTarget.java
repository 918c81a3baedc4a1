package io.surfworks.stablebridge.conversion;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

import io.surfworks.stablebridge.ir.OpKind;
import io.surfworks.stablebridge.ir.Operation;

/**
 * Describes which operations are legal after a conversion.
 *
 * <p>An operation whose kind has a dynamic legality check is legal when the
 * check accepts it. Otherwise it is illegal when its dialect is one of the
 * illegal namespaces; everything else is legal.
 *
 * @param illegalDialects namespaces whose operations must be converted away
 * @param dynamicLegality per-kind checks that override the dialect rule
 */
public record ConversionTarget(Set<String> illegalDialects, Map<OpKind, Predicate<Operation>> dynamicLegality) {

    public ConversionTarget {
        illegalDialects = Set.copyOf(illegalDialects);
        dynamicLegality = Map.copyOf(dynamicLegality);
    }

    public static ConversionTarget withIllegalDialect(String namespace) {
        return new ConversionTarget(Set.of(namespace), Map.of());
    }

    /**
     * Returns a target where operations of {@code kind} are legal only when
     * {@code isLegal} accepts them.
     */
    public ConversionTarget withDynamicLegality(OpKind kind, Predicate<Operation> isLegal) {
        Map<OpKind, Predicate<Operation>> checks = new HashMap<>(dynamicLegality);
        checks.put(kind, isLegal);
        return new ConversionTarget(illegalDialects, checks);
    }

    public boolean isLegal(Operation op) {
        Predicate<Operation> check = dynamicLegality.get(op.kind());
        if (check != null) {
            return check.test(op);
        }
        return !illegalDialects.contains(op.dialect());
    }
}
