package io.surfworks.stablebridge.conversion;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

import io.surfworks.stablebridge.ir.Block;
import io.surfworks.stablebridge.ir.Operation;
import io.surfworks.stablebridge.ir.Region;
import io.surfworks.stablebridge.ir.Type;
import io.surfworks.stablebridge.ir.Value;

/**
 * Applies conversion patterns to every illegal operation nested in a root
 * operation.
 *
 * <p>The driver walks the program in pre-order. For each illegal operation
 * with a registered pattern it remaps the operands to their converted values,
 * invokes the pattern and, on success, puts the replacement in place of the
 * original and records the mapping from old results to new results. Blocks of
 * regions moved into a replacement get their argument types converted too.
 * Nested operations are visited after their parent, so they are converted in
 * their own right.
 *
 * <p>Walks repeat until one converts nothing or the sweep limit is reached.
 * Finally the operands of every remaining operation, legal or not, are
 * remapped so that no operand refers to a replaced value.
 *
 * <p>Example usage:
 * <pre>{@code
 * ConversionDriver driver = new ConversionDriver(
 *     patterns, typeConverter, ConversionTarget.withIllegalDialect("stablehlo"), 8);
 * ConversionResult result = driver.apply(module);
 * if (!result.isComplete()) {
 *     // result.illegalRemaining() lists what could not be converted
 * }
 * }</pre>
 */
public final class ConversionDriver {

    private static final Logger LOG = Logger.getLogger(ConversionDriver.class.getName());

    private final PatternSet patterns;
    private final TypeConverter typeConverter;
    private final ConversionTarget target;
    private final int maxSweeps;
    private final Map<Value, Value> mapping = new IdentityHashMap<>();

    /**
     * Creates a driver.
     *
     * @param patterns patterns by operation kind
     * @param typeConverter converter for block argument types
     * @param target which operations must be converted
     * @param maxSweeps upper bound on walks over the program, at least 1
     */
    public ConversionDriver(PatternSet patterns, TypeConverter typeConverter,
                            ConversionTarget target, int maxSweeps) {
        this.patterns = Objects.requireNonNull(patterns, "patterns cannot be null");
        this.typeConverter = Objects.requireNonNull(typeConverter, "typeConverter cannot be null");
        this.target = Objects.requireNonNull(target, "target cannot be null");
        if (maxSweeps < 1) {
            throw new IllegalArgumentException("maxSweeps must be at least 1, got " + maxSweeps);
        }
        this.maxSweeps = maxSweeps;
    }

    /**
     * Converts every illegal operation nested in {@code root}.
     *
     * <p>{@code root} itself is never replaced.
     *
     * @param root the operation holding the program, typically a module
     * @return the outcome of the run
     */
    public ConversionResult apply(Operation root) {
        mapping.clear();
        int converted = 0;
        int sweeps = 0;
        boolean changed = true;
        while (changed && sweeps < maxSweeps) {
            sweeps++;
            int convertedInSweep = convertNested(root);
            converted += convertedInSweep;
            changed = convertedInSweep > 0;
            LOG.fine("Sweep " + sweeps + " converted " + convertedInSweep + " operations");
        }

        remapOperands(root);

        List<Operation> illegal = new ArrayList<>();
        root.walk(op -> {
            if (op != root && !target.isLegal(op)) {
                illegal.add(op);
            }
        });
        return new ConversionResult(converted, sweeps, illegal);
    }

    /**
     * Returns the value {@code value} has been replaced by, or itself.
     */
    public Value lookup(Value value) {
        Value current = value;
        Value next = mapping.get(current);
        while (next != null) {
            current = next;
            next = mapping.get(current);
        }
        return current;
    }

    private int convertNested(Operation op) {
        int count = 0;
        for (Region region : op.regions()) {
            for (Block block : List.copyOf(region.blocks())) {
                for (Operation nested : List.copyOf(block.operations())) {
                    Operation current = nested;
                    if (!target.isLegal(nested)) {
                        Optional<Operation> replacement = tryConvert(nested);
                        if (replacement.isPresent()) {
                            current = replacement.get();
                            count++;
                        }
                    }
                    count += convertNested(current);
                }
            }
        }
        return count;
    }

    private Optional<Operation> tryConvert(Operation op) {
        Optional<ConversionPattern> pattern = patterns.lookup(op.kind());
        if (pattern.isEmpty()) {
            LOG.fine("No pattern registered for " + op.name());
            return Optional.empty();
        }

        List<Value> operands = op.operands().stream().map(this::lookup).toList();
        Optional<Operation> rewritten = pattern.get().matchAndRewrite(op, operands);
        if (rewritten.isEmpty()) {
            LOG.fine("Failed to convert " + op.name());
            return Optional.empty();
        }

        Operation replacement = rewritten.get();
        if (replacement.results().size() != op.results().size()) {
            throw new IllegalStateException(String.format(
                    "Replacement %s has %d results, %s has %d",
                    replacement.name(), replacement.results().size(), op.name(), op.results().size()));
        }
        op.parentBlock().replace(op, replacement);
        for (int i = 0; i < op.results().size(); i++) {
            mapping.put(op.result(i), replacement.result(i));
        }
        convertBlockArguments(replacement);
        LOG.fine("Converted " + op.name() + " to " + replacement.name());
        return Optional.of(replacement);
    }

    private void convertBlockArguments(Operation op) {
        for (Region region : op.regions()) {
            for (Block block : region.blocks()) {
                for (int i = 0; i < block.arguments().size(); i++) {
                    Value arg = block.argument(i);
                    Optional<Type> converted = typeConverter.convertType(arg.type());
                    if (converted.isEmpty()) {
                        LOG.fine("Cannot convert block argument type " + arg.type().toMlirString());
                        continue;
                    }
                    if (!converted.get().equals(arg.type())) {
                        mapping.put(arg, block.replaceArgument(i, converted.get()));
                    }
                }
            }
        }
    }

    private void remapOperands(Operation root) {
        root.walk(op -> {
            for (int i = 0; i < op.operands().size(); i++) {
                Value mapped = lookup(op.operand(i));
                if (mapped != op.operand(i)) {
                    op.setOperand(i, mapped);
                }
            }
        });
    }
}
