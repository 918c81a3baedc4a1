package io.surfworks.stablebridge.ir;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders operations in MLIR generic form.
 *
 * <p>Used for logs and debugging. The output is not meant to be parsed back.
 *
 * <pre>{@code
 * %0 = "mhlo.add"(%arg0, %arg1) : (tensor<4xf32>, tensor<4xf32>) -> tensor<4xf32>
 * }</pre>
 */
public final class IrPrinter {

    private final StringBuilder sb = new StringBuilder();
    private final Map<Value, String> names = new IdentityHashMap<>();
    private int nextResult = 0;
    private int nextArgument = 0;
    private int indent = 0;

    /**
     * Prints an operation and everything nested in it.
     */
    public static String print(Operation op) {
        IrPrinter printer = new IrPrinter();
        printer.emitOperation(op);
        return printer.sb.toString();
    }

    private void emitOperation(Operation op) {
        StringBuilder line = new StringBuilder();
        if (!op.results().isEmpty()) {
            for (int i = 0; i < op.results().size(); i++) {
                if (i > 0) line.append(", ");
                line.append(nameOf(op.result(i)));
            }
            line.append(" = ");
        }
        line.append('"').append(op.name()).append("\"(");
        line.append(joinValues(op.operands()));
        line.append(")");

        if (op.regions().isEmpty()) {
            line.append(attributeSuffix(op)).append(signature(op));
            emitLine("%s", line);
            return;
        }

        line.append(" (");
        for (int r = 0; r < op.regions().size(); r++) {
            line.append("{");
            emitLine("%s", line);
            line.setLength(0);
            emitRegion(op.region(r));
            line.append("}");
            if (r + 1 < op.regions().size()) {
                line.append(", ");
            }
        }
        line.append(")").append(attributeSuffix(op)).append(signature(op));
        emitLine("%s", line);
    }

    private void emitRegion(Region region) {
        for (Block block : region.blocks()) {
            if (!block.arguments().isEmpty()) {
                StringBuilder header = new StringBuilder("^bb(");
                for (int i = 0; i < block.arguments().size(); i++) {
                    if (i > 0) header.append(", ");
                    Value arg = block.argument(i);
                    header.append(nameOf(arg)).append(": ").append(arg.type().toMlirString());
                }
                emitLine("%s):", header);
            }
            indent++;
            for (Operation op : block.operations()) {
                emitOperation(op);
            }
            indent--;
        }
    }

    private String attributeSuffix(Operation op) {
        if (op.attributes().isEmpty()) {
            return "";
        }
        StringBuilder attrs = new StringBuilder(" {");
        boolean first = true;
        for (Map.Entry<String, Attribute> e : op.attributes().entrySet()) {
            if (!first) attrs.append(", ");
            attrs.append(e.getKey()).append(" = ").append(e.getValue().toMlirString());
            first = false;
        }
        return attrs.append("}").toString();
    }

    private String signature(Operation op) {
        List<Type> operandTypes = op.operands().stream().map(Value::type).toList();
        List<Type> resultTypes = op.resultTypes();
        String results = resultTypes.size() == 1
                ? resultTypes.get(0).toMlirString()
                : "(" + Types.join(resultTypes) + ")";
        return " : (" + Types.join(operandTypes) + ") -> " + results;
    }

    private String joinValues(List<Value> values) {
        StringBuilder s = new StringBuilder();
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) s.append(", ");
            s.append(nameOf(values.get(i)));
        }
        return s.toString();
    }

    private String nameOf(Value value) {
        return names.computeIfAbsent(value, v -> v.isBlockArgument()
                ? "%arg" + nextArgument++
                : "%" + nextResult++);
    }

    private void emitLine(String format, Object... args) {
        for (int i = 0; i < indent; i++) {
            sb.append("  ");
        }
        sb.append(String.format(format, args));
        sb.append("\n");
    }
}
