package io.surfworks.warplayout.ir;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

import io.surfworks.warplayout.ir.layout.Layout;

/**
 * An SSA value: an operation result or a block argument.
 *
 * <p>Values are identified by identity. Each value keeps the list of operands
 * that currently use it, so replacing a value or erasing a user keeps the
 * def-use graph consistent in both directions.
 */
public abstract sealed class Value permits OpResult, BlockArgument {

    private Type type;
    private final List<OpOperand> uses = new ArrayList<>();

    Value(Type type) {
        this.type = Objects.requireNonNull(type, "type cannot be null");
    }

    public Type getType() {
        return type;
    }

    public void setType(Type type) {
        this.type = Objects.requireNonNull(type, "type cannot be null");
    }

    /**
     * Returns the tensor type of this value, or null if it is not a tensor.
     */
    public TensorType tensorType() {
        return type instanceof TensorType tt ? tt : null;
    }

    public boolean isTensor() {
        return type instanceof TensorType;
    }

    /**
     * Returns the layout of this value, or null if it is not a tensor.
     */
    public Layout layout() {
        return type instanceof TensorType tt ? tt.layout() : null;
    }

    /**
     * Returns the operation defining this value, or null for block arguments.
     */
    public abstract Operation getDefiningOp();

    /**
     * Returns the block this value is defined in.
     */
    public abstract Block getParentBlock();

    /**
     * Returns a snapshot of the operands currently using this value.
     */
    public List<OpOperand> getUses() {
        return List.copyOf(uses);
    }

    /**
     * Returns the distinct operations using this value, in use order.
     */
    public List<Operation> getUsers() {
        List<Operation> users = new ArrayList<>();
        for (OpOperand use : uses) {
            if (!users.contains(use.getOwner())) {
                users.add(use.getOwner());
            }
        }
        return users;
    }

    public boolean useEmpty() {
        return uses.isEmpty();
    }

    public boolean hasOneUse() {
        return uses.size() == 1;
    }

    public int useCount() {
        return uses.size();
    }

    public void replaceAllUsesWith(Value replacement) {
        Objects.requireNonNull(replacement, "replacement cannot be null");
        if (replacement == this) {
            return;
        }
        for (OpOperand use : List.copyOf(uses)) {
            use.set(replacement);
        }
    }

    public void replaceUsesWithIf(Value replacement, Predicate<OpOperand> shouldReplace) {
        Objects.requireNonNull(replacement, "replacement cannot be null");
        if (replacement == this) {
            return;
        }
        for (OpOperand use : List.copyOf(uses)) {
            if (shouldReplace.test(use)) {
                use.set(replacement);
            }
        }
    }

    void addUse(OpOperand use) {
        uses.add(use);
    }

    void removeUse(OpOperand use) {
        for (int i = 0; i < uses.size(); i++) {
            if (uses.get(i) == use) {
                uses.remove(i);
                return;
            }
        }
    }

    boolean hasUse(OpOperand use) {
        for (OpOperand u : uses) {
            if (u == use) {
                return true;
            }
        }
        return false;
    }

    @Override
    public final boolean equals(Object o) {
        return this == o;
    }

    @Override
    public final int hashCode() {
        return System.identityHashCode(this);
    }
}
