package io.surfworks.warplayout.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ordered list of operations with the arguments bound on entry.
 */
public final class Block {

    private final List<BlockArgument> arguments = new ArrayList<>();
    private final List<Operation> operations = new ArrayList<>();
    private Region parent;

    Block(Region parent) {
        this.parent = parent;
    }

    public Region getParent() {
        return parent;
    }

    void setParent(Region parent) {
        this.parent = parent;
    }

    /**
     * Returns the operation owning this block's region, or null for a function body.
     */
    public Operation getParentOp() {
        return parent == null ? null : parent.getParentOp();
    }

    // ==================== Arguments ====================

    public BlockArgument addArgument(Type type) {
        BlockArgument arg = new BlockArgument(this, arguments.size(), type);
        arguments.add(arg);
        return arg;
    }

    /**
     * Removes an unused argument, renumbering the following ones.
     */
    public void eraseArgument(int index) {
        BlockArgument arg = arguments.get(index);
        if (!arg.useEmpty()) {
            throw new IllegalStateException("Cannot erase block argument #" + index + ": still in use");
        }
        arguments.remove(index);
        for (int i = index; i < arguments.size(); i++) {
            arguments.get(i).setArgNumber(i);
        }
    }

    public BlockArgument getArgument(int index) {
        return arguments.get(index);
    }

    public List<BlockArgument> getArguments() {
        return Collections.unmodifiableList(arguments);
    }

    public int getNumArguments() {
        return arguments.size();
    }

    // ==================== Operations ====================

    /**
     * Returns a snapshot of the operations in this block.
     */
    public List<Operation> getOperations() {
        return List.copyOf(operations);
    }

    public int size() {
        return operations.size();
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }

    public Operation getTerminator() {
        if (operations.isEmpty()) {
            return null;
        }
        Operation last = operations.get(operations.size() - 1);
        return last.getOpcode().isTerminator() ? last : null;
    }

    public int indexOf(Operation op) {
        for (int i = 0; i < operations.size(); i++) {
            if (operations.get(i) == op) {
                return i;
            }
        }
        return -1;
    }

    void insert(int index, Operation op) {
        if (op.getBlock() != null) {
            throw new IllegalStateException("Operation " + op.getOpcode() + " is already in a block");
        }
        operations.add(index, op);
        op.setBlock(this);
    }

    public void append(Operation op) {
        insert(operations.size(), op);
    }

    void remove(Operation op) {
        int index = indexOf(op);
        if (index < 0) {
            throw new IllegalStateException("Operation " + op.getOpcode() + " is not in this block");
        }
        operations.remove(index);
        op.setBlock(null);
    }

    /**
     * Moves every operation of {@code source} to the front of this block, keeping their order.
     */
    public void spliceFrom(Block source) {
        List<Operation> moved = new ArrayList<>(source.operations);
        source.operations.clear();
        for (Operation op : moved) {
            op.setBlock(this);
        }
        operations.addAll(0, moved);
    }

    /**
     * Moves the given operation to just before {@code before} (which must be in this block).
     */
    public void moveBefore(Operation op, Operation before) {
        op.getBlock().remove(op);
        insert(indexOf(before), op);
    }
}
