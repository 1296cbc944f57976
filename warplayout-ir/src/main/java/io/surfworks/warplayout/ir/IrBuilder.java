package io.surfworks.warplayout.ir;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Creates operations at an insertion point.
 *
 * <p>The insertion point is "before operation X" or "at the end of block B";
 * every operation created is inserted there, so successive creations come out
 * in creation order.
 *
 * <p>Example:
 * <pre>{@code
 * IrBuilder b = IrBuilder.atEnd(function.getEntryBlock());
 * Value e = b.unary(Opcode.EXP, function.getArgument(0));
 * Value c = b.convertLayout(e, e.tensorType().withLayout(other));
 * b.ret(List.of(c));
 * }</pre>
 */
public final class IrBuilder {

    private Block block;
    private Operation before;

    public IrBuilder() {}

    public static IrBuilder atEnd(Block block) {
        IrBuilder builder = new IrBuilder();
        builder.setInsertionPointToEnd(block);
        return builder;
    }

    public static IrBuilder before(Operation op) {
        IrBuilder builder = new IrBuilder();
        builder.setInsertionPoint(op);
        return builder;
    }

    // ==================== Insertion point ====================

    public void setInsertionPoint(Operation op) {
        if (op.getBlock() == null) {
            throw new IllegalArgumentException("Operation " + op.getOpcode() + " is not in a block");
        }
        this.block = op.getBlock();
        this.before = op;
    }

    public void setInsertionPointAfter(Operation op) {
        Block b = op.getBlock();
        if (b == null) {
            throw new IllegalArgumentException("Operation " + op.getOpcode() + " is not in a block");
        }
        List<Operation> ops = b.getOperations();
        int index = b.indexOf(op);
        this.block = b;
        this.before = index + 1 < ops.size() ? ops.get(index + 1) : null;
    }

    /**
     * Moves the insertion point to just after the definition of {@code value}:
     * after its defining operation, or at the start of its block for a block argument.
     */
    public void setInsertionPointAfterValue(Value value) {
        Operation def = value.getDefiningOp();
        if (def != null) {
            setInsertionPointAfter(def);
        } else {
            setInsertionPointToStart(value.getParentBlock());
        }
    }

    public void setInsertionPointToStart(Block b) {
        this.block = b;
        this.before = b.isEmpty() ? null : b.getOperations().get(0);
    }

    public void setInsertionPointToEnd(Block b) {
        this.block = b;
        this.before = null;
    }

    public Block getInsertionBlock() {
        return block;
    }

    // ==================== Creation ====================

    public Operation create(Opcode opcode, List<Value> operands, List<Type> resultTypes,
                            Map<String, Object> attributes, int numRegions) {
        Operation op = new Operation(opcode, operands, resultTypes, attributes, numRegions);
        insert(op);
        return op;
    }

    public Operation create(Opcode opcode, List<Value> operands, List<Type> resultTypes) {
        return create(opcode, operands, resultTypes, Map.of(), 0);
    }

    private void insert(Operation op) {
        if (block == null) {
            throw new IllegalStateException("No insertion point set");
        }
        if (before == null) {
            block.append(op);
        } else {
            int index = block.indexOf(before);
            if (index < 0) {
                throw new IllegalStateException("Insertion point operation " + before.getOpcode() + " left its block");
            }
            block.insert(index, op);
        }
    }

    /**
     * Clones an operation, including nested regions, keeping its operands.
     */
    public Operation clone(Operation op) {
        return clone(op, new IrMapping());
    }

    /**
     * Clones an operation, including nested regions. Operands are remapped through
     * {@code mapping} where an entry exists; the clone's results (and the values
     * defined in its regions) are added to the mapping.
     */
    public Operation clone(Operation op, IrMapping mapping) {
        Operation copy = cloneWithoutInsert(op, mapping);
        insert(copy);
        return copy;
    }

    private static Operation cloneWithoutInsert(Operation op, IrMapping mapping) {
        List<Value> operands = new ArrayList<>(op.getNumOperands());
        for (Value v : op.getOperands()) {
            operands.add(mapping.lookupOrDefault(v));
        }
        Operation copy = new Operation(op.getOpcode(), operands, op.getResultTypes(),
                op.getAttributes(), op.getNumRegions());
        for (int i = 0; i < op.getNumResults(); i++) {
            mapping.map(op.getResult(i), copy.getResult(i));
        }
        for (int r = 0; r < op.getNumRegions(); r++) {
            Block source = op.getRegion(r).getBlock();
            Block target = copy.getRegion(r).getBlock();
            for (BlockArgument arg : source.getArguments()) {
                mapping.map(arg, target.addArgument(arg.getType()));
            }
            for (Operation nested : source.getOperations()) {
                target.append(cloneWithoutInsert(nested, mapping));
            }
        }
        return copy;
    }

    // ==================== Convenience factories ====================

    public Value convertLayout(Value source, TensorType resultType) {
        TensorType sourceType = requireTensor(source);
        if (!sourceType.sameShapeAndElement(resultType)) {
            throw new IllegalArgumentException("convert_layout cannot change shape or element type: "
                    + sourceType.toMlirString() + " -> " + resultType.toMlirString());
        }
        return create(Opcode.CONVERT_LAYOUT, List.of(source), List.of(resultType)).getResult(0);
    }

    /**
     * Creates a constant. A tensor-typed constant is a splat of {@code value}.
     */
    public Value constant(Type type, Number value) {
        return create(Opcode.CONSTANT, List.of(), List.of(type), Map.of("value", value), 0).getResult(0);
    }

    public Value splat(Value scalar, TensorType resultType) {
        return create(Opcode.SPLAT, List.of(scalar), List.of(resultType)).getResult(0);
    }

    public Value makeRange(int start, int end, TensorType resultType) {
        return create(Opcode.MAKE_RANGE, List.of(), List.of(resultType),
                Map.of("start", start, "end", end), 0).getResult(0);
    }

    /**
     * Creates a binary elementwise op whose result type is the left operand's type.
     */
    public Value binary(Opcode opcode, Value lhs, Value rhs) {
        return create(opcode, List.of(lhs, rhs), List.of(lhs.getType())).getResult(0);
    }

    /**
     * Creates a unary elementwise op whose result type is the operand's type.
     */
    public Value unary(Opcode opcode, Value operand) {
        return create(opcode, List.of(operand), List.of(operand.getType())).getResult(0);
    }

    /**
     * Creates a unary op with an explicit result type (casts, broadcast, reshape).
     */
    public Value unary(Opcode opcode, Value operand, Type resultType) {
        return create(opcode, List.of(operand), List.of(resultType)).getResult(0);
    }

    public Value dot(Value a, Value b, Value accumulator) {
        return create(Opcode.DOT, List.of(a, b, accumulator), List.of(accumulator.getType()),
                Map.of("allow_tf32", true), 0).getResult(0);
    }

    public Value load(Value pointers, Type resultType) {
        return create(Opcode.LOAD, List.of(pointers), List.of(resultType)).getResult(0);
    }

    public Operation store(Value pointers, Value value) {
        return create(Opcode.STORE, List.of(pointers, value), List.of());
    }

    public Value atomicRmw(String kind, Value pointers, Value value) {
        return create(Opcode.ATOMIC_RMW, List.of(pointers, value), List.of(value.getType()),
                Map.of("kind", kind), 0).getResult(0);
    }

    public Value reduce(Value operand, int axis, String combine, Type resultType) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("axis", axis);
        attrs.put("combine", combine);
        return create(Opcode.REDUCE, List.of(operand), List.of(resultType), attrs, 0).getResult(0);
    }

    public Value expandDims(Value operand, int axis, TensorType resultType) {
        return create(Opcode.EXPAND_DIMS, List.of(operand), List.of(resultType),
                Map.of("axis", axis), 0).getResult(0);
    }

    public Value broadcast(Value operand, TensorType resultType) {
        return create(Opcode.BROADCAST, List.of(operand), List.of(resultType)).getResult(0);
    }

    public Value reshape(Value operand, TensorType resultType, boolean allowReorder) {
        return create(Opcode.RESHAPE, List.of(operand), List.of(resultType),
                Map.of("allow_reorder", allowReorder), 0).getResult(0);
    }

    /**
     * Creates an {@code scf.for} with an empty body whose block arguments are the
     * induction variable (typed like the lower bound) and one argument per init.
     * The caller fills the body and terminates it with {@link #yield(List)}.
     */
    public ForOp forLoop(Value lowerBound, Value upperBound, Value step, List<Value> inits) {
        List<Value> operands = new ArrayList<>();
        operands.add(lowerBound);
        operands.add(upperBound);
        operands.add(step);
        operands.addAll(inits);
        Operation op = create(Opcode.FOR, operands, ForOp.typesOf(inits), Map.of(), 1);
        Block body = op.getRegion(0).getBlock();
        body.addArgument(lowerBound.getType());
        for (Value init : inits) {
            body.addArgument(init.getType());
        }
        return ForOp.wrap(op);
    }

    /**
     * Creates an {@code scf.while} with empty, argument-less regions.
     */
    public WhileOp whileLoop(List<Type> resultTypes, List<Value> inits) {
        return WhileOp.wrap(create(Opcode.WHILE, inits, resultTypes, Map.of(), 2));
    }

    /**
     * Creates an {@code scf.if} with empty then/else regions.
     */
    public IfOp ifThenElse(List<Type> resultTypes, Value condition) {
        return IfOp.wrap(create(Opcode.IF, List.of(condition), resultTypes, Map.of(), 2));
    }

    public Operation yield(List<Value> values) {
        return create(Opcode.YIELD, values, List.of());
    }

    public Operation condition(Value condition, List<Value> values) {
        List<Value> operands = new ArrayList<>();
        operands.add(condition);
        operands.addAll(values);
        return create(Opcode.CONDITION, operands, List.of());
    }

    public Operation ret(List<Value> values) {
        return create(Opcode.RETURN, values, List.of());
    }

    private static TensorType requireTensor(Value value) {
        Objects.requireNonNull(value, "value cannot be null");
        TensorType tt = value.tensorType();
        if (tt == null) {
            throw new IllegalArgumentException("Expected a tensor value but got " + value.getType().toMlirString());
        }
        return tt;
    }
}
