package io.surfworks.warplayout.ir;

import java.util.function.Consumer;

/**
 * A single-block region of a structured operation (or of a function body).
 */
public final class Region {

    private final Operation parentOp;
    private Block block;

    Region(Operation parentOp) {
        this.parentOp = parentOp;
        this.block = new Block(this);
    }

    public Operation getParentOp() {
        return parentOp;
    }

    public Block getBlock() {
        return block;
    }

    /**
     * Takes the block of another region, leaving that region with an empty block.
     */
    public void takeBody(Region other) {
        Block taken = other.block;
        other.block = new Block(other);
        taken.setParent(this);
        this.block = taken;
    }

    public void walk(Consumer<Operation> visitor) {
        for (Operation op : block.getOperations()) {
            op.walk(visitor);
        }
    }
}
