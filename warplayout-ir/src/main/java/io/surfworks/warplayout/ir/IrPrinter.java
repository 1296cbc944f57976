package io.surfworks.warplayout.ir;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders modules and functions in a generic MLIR-like syntax.
 *
 * <p>Operation results are numbered {@code %0, %1, ...} and block arguments
 * {@code %arg0, %arg1, ...} in program order, per function. The output is meant
 * for debug logging and test diagnostics; there is no parser for it.
 */
public final class IrPrinter {

    private static final String INDENT = "  ";

    private final Map<Value, String> names = new IdentityHashMap<>();
    private int nextResult;
    private int nextArgument;

    private IrPrinter() {}

    public static String print(Module module) {
        StringBuilder sb = new StringBuilder();
        sb.append("module @").append(module.name());
        if (!module.attributes().isEmpty()) {
            sb.append(" attributes ").append(formatAttributes(module.attributes()));
        }
        sb.append(" {\n");
        for (Function f : module.functions()) {
            new IrPrinter().printFunction(f, sb, 1);
        }
        sb.append("}\n");
        return sb.toString();
    }

    public static String print(Function function) {
        StringBuilder sb = new StringBuilder();
        new IrPrinter().printFunction(function, sb, 0);
        return sb.toString();
    }

    /**
     * Renders one operation (and its regions) with names local to that operation.
     */
    public static String print(Operation op) {
        StringBuilder sb = new StringBuilder();
        new IrPrinter().printOperation(op, sb, 0);
        return sb.toString();
    }

    private void printFunction(Function f, StringBuilder sb, int depth) {
        indent(sb, depth);
        sb.append("tt.func ").append(f.isPublic() ? "public " : "private ").append("@").append(f.name()).append("(");
        List<BlockArgument> args = f.getArguments();
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(nameOf(args.get(i))).append(": ").append(args.get(i).getType().toMlirString());
        }
        sb.append(") {\n");
        for (Operation op : f.getEntryBlock().getOperations()) {
            printOperation(op, sb, depth + 1);
        }
        indent(sb, depth);
        sb.append("}\n");
    }

    private void printOperation(Operation op, StringBuilder sb, int depth) {
        indent(sb, depth);
        if (op.getNumResults() > 0) {
            for (int i = 0; i < op.getNumResults(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(nameOf(op.getResult(i)));
            }
            sb.append(" = ");
        }
        sb.append(op.getOpcode().mnemonic()).append("(");
        List<Value> operands = op.getOperands();
        for (int i = 0; i < operands.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(nameOf(operands.get(i)));
        }
        sb.append(")");
        if (!op.getAttributes().isEmpty()) {
            sb.append(" ").append(formatAttributes(op.getAttributes()));
        }
        for (Region region : op.getRegions()) {
            printRegion(region, sb, depth);
        }
        sb.append(" : (");
        for (int i = 0; i < operands.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(operands.get(i).getType().toMlirString());
        }
        sb.append(") -> (");
        for (int i = 0; i < op.getNumResults(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(op.getResult(i).getType().toMlirString());
        }
        sb.append(")\n");
    }

    private void printRegion(Region region, StringBuilder sb, int depth) {
        Block block = region.getBlock();
        sb.append(" ({\n");
        if (block.getNumArguments() > 0) {
            indent(sb, depth);
            sb.append("^bb(");
            for (int i = 0; i < block.getNumArguments(); i++) {
                if (i > 0) sb.append(", ");
                BlockArgument arg = block.getArgument(i);
                sb.append(nameOf(arg)).append(": ").append(arg.getType().toMlirString());
            }
            sb.append("):\n");
        }
        for (Operation nested : block.getOperations()) {
            printOperation(nested, sb, depth + 1);
        }
        indent(sb, depth);
        sb.append("})");
    }

    private String nameOf(Value value) {
        String name = names.get(value);
        if (name == null) {
            name = value instanceof BlockArgument ? "%arg" + nextArgument++ : "%" + nextResult++;
            names.put(value, name);
        }
        return name;
    }

    private static String formatAttributes(Map<String, Object> attributes) {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Object> e : attributes.entrySet()) {
            if (!first) sb.append(", ");
            first = false;
            sb.append(e.getKey()).append(" = ");
            Object v = e.getValue();
            if (v instanceof String s) {
                sb.append('"').append(s).append('"');
            } else {
                sb.append(v);
            }
        }
        sb.append("}");
        return sb.toString();
    }

    private static void indent(StringBuilder sb, int depth) {
        sb.append(INDENT.repeat(depth));
    }
}
