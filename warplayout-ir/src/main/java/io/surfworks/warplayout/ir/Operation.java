package io.surfworks.warplayout.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * A node of the IR graph.
 *
 * <p>An operation has an {@link Opcode}, an ordered list of operands, an ordered
 * list of results, zero or more nested regions and a map of attributes. It is
 * owned by the block it sits in; {@link #erase()} detaches it and releases its
 * operands.
 *
 * <p>Operations are created through {@link IrBuilder}.
 */
public final class Operation {

    private final Opcode opcode;
    private final List<OpOperand> operands = new ArrayList<>();
    private final List<OpResult> results = new ArrayList<>();
    private final List<Region> regions = new ArrayList<>();
    private final Map<String, Object> attributes = new LinkedHashMap<>();
    private Block block;
    private boolean erased;

    Operation(Opcode opcode, List<Value> operandValues, List<Type> resultTypes,
              Map<String, Object> attributes, int numRegions) {
        this.opcode = Objects.requireNonNull(opcode, "opcode cannot be null");
        for (Value v : operandValues) {
            operands.add(new OpOperand(this, operands.size(), v));
        }
        for (Type t : resultTypes) {
            results.add(new OpResult(this, results.size(), t));
        }
        for (int i = 0; i < numRegions; i++) {
            regions.add(new Region(this));
        }
        if (attributes != null) {
            this.attributes.putAll(attributes);
        }
    }

    public Opcode getOpcode() {
        return opcode;
    }

    public OpCategory getCategory() {
        return opcode.category();
    }

    public boolean is(Opcode other) {
        return opcode == other;
    }

    // ==================== Operands ====================

    public int getNumOperands() {
        return operands.size();
    }

    public Value getOperand(int index) {
        return operands.get(index).get();
    }

    public OpOperand getOpOperand(int index) {
        return operands.get(index);
    }

    public List<OpOperand> getOpOperands() {
        return Collections.unmodifiableList(operands);
    }

    public List<Value> getOperands() {
        List<Value> values = new ArrayList<>(operands.size());
        for (OpOperand operand : operands) {
            values.add(operand.get());
        }
        return values;
    }

    public void setOperand(int index, Value value) {
        operands.get(index).set(value);
    }

    /**
     * Removes the operand at the given index, renumbering the following operands.
     */
    public void eraseOperand(int index) {
        OpOperand removed = operands.remove(index);
        removed.drop();
        for (int i = index; i < operands.size(); i++) {
            operands.get(i).setOperandNumber(i);
        }
    }

    // ==================== Results ====================

    public int getNumResults() {
        return results.size();
    }

    public OpResult getResult(int index) {
        return results.get(index);
    }

    public List<OpResult> getResults() {
        return Collections.unmodifiableList(results);
    }

    public List<Type> getResultTypes() {
        List<Type> types = new ArrayList<>(results.size());
        for (OpResult r : results) {
            types.add(r.getType());
        }
        return types;
    }

    /**
     * Returns true if no result of this operation is used.
     */
    public boolean resultsUnused() {
        for (OpResult r : results) {
            if (!r.useEmpty()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the distinct operations using any result of this operation.
     */
    public List<Operation> getUsers() {
        List<Operation> users = new ArrayList<>();
        for (OpResult r : results) {
            for (Operation user : r.getUsers()) {
                if (!users.contains(user)) {
                    users.add(user);
                }
            }
        }
        return users;
    }

    public void replaceAllUsesWith(List<? extends Value> replacements) {
        if (replacements.size() != results.size()) {
            throw new IllegalArgumentException(String.format(
                    "%s has %d results but %d replacements were given",
                    opcode, results.size(), replacements.size()));
        }
        for (int i = 0; i < results.size(); i++) {
            results.get(i).replaceAllUsesWith(replacements.get(i));
        }
    }

    // ==================== Regions ====================

    public int getNumRegions() {
        return regions.size();
    }

    public Region getRegion(int index) {
        return regions.get(index);
    }

    public List<Region> getRegions() {
        return Collections.unmodifiableList(regions);
    }

    // ==================== Attributes ====================

    public Map<String, Object> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    @SuppressWarnings("unchecked")
    public <T> T attribute(String name) {
        return (T) attributes.get(name);
    }

    @SuppressWarnings("unchecked")
    public <T> T attribute(String name, T defaultValue) {
        Object value = attributes.get(name);
        return value != null ? (T) value : defaultValue;
    }

    public void setAttribute(String name, Object value) {
        attributes.put(name, value);
    }

    public void setAttributes(Map<String, Object> newAttributes) {
        attributes.clear();
        attributes.putAll(newAttributes);
    }

    // ==================== Structure ====================

    /**
     * Returns the block containing this operation, or null if it is detached.
     */
    public Block getBlock() {
        return block;
    }

    void setBlock(Block block) {
        this.block = block;
    }

    /**
     * Returns the operation owning the region this operation is in, or null at
     * function level.
     */
    public Operation getParentOp() {
        return block == null ? null : block.getParentOp();
    }

    public boolean isErased() {
        return erased;
    }

    /**
     * Returns true if this operation precedes the other in their common block.
     */
    public boolean isBeforeInBlock(Operation other) {
        if (block == null || block != other.block) {
            throw new IllegalArgumentException("Operations are not in the same block");
        }
        return block.indexOf(this) < block.indexOf(other);
    }

    /**
     * Returns true if this operation is, or is nested inside, the given operation.
     */
    public boolean isAncestorOrSelf(Operation ancestor) {
        Operation current = this;
        while (current != null) {
            if (current == ancestor) {
                return true;
            }
            current = current.getParentOp();
        }
        return false;
    }

    /**
     * Visits this operation and every operation nested in its regions, in program order.
     */
    public void walk(Consumer<Operation> visitor) {
        visitor.accept(this);
        for (Region region : regions) {
            region.walk(visitor);
        }
    }

    /**
     * Releases every operand of this operation and of all nested operations.
     */
    public void dropAllReferences() {
        for (OpOperand operand : operands) {
            operand.drop();
        }
        for (Region region : regions) {
            for (Operation nested : region.getBlock().getOperations()) {
                nested.dropAllReferences();
            }
        }
    }

    /**
     * Detaches this operation from its block and releases its operands.
     *
     * @throws IllegalStateException if any result is still used
     */
    public void erase() {
        if (erased) {
            throw new IllegalStateException("Operation " + opcode + " was already erased");
        }
        for (OpResult result : results) {
            if (!result.useEmpty()) {
                throw new IllegalStateException(String.format(
                        "Cannot erase %s: result #%d still has %d use(s)",
                        opcode, result.getResultNumber(), result.useCount()));
            }
        }
        dropAllReferences();
        if (block != null) {
            block.remove(this);
        }
        markErased();
    }

    private void markErased() {
        erased = true;
        for (Region region : regions) {
            for (Operation nested : region.getBlock().getOperations()) {
                nested.markErased();
            }
        }
    }

    @Override
    public String toString() {
        return opcode.mnemonic() + "(" + operands.size() + " operands, " + results.size() + " results)";
    }
}
