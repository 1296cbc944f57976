package io.surfworks.warplayout.ir;

import java.util.Objects;

/**
 * One operand slot of an operation, linking the operation to the value it uses.
 */
public final class OpOperand {

    private final Operation owner;
    private int operandNumber;
    private Value value;

    OpOperand(Operation owner, int operandNumber, Value value) {
        this.owner = owner;
        this.operandNumber = operandNumber;
        this.value = Objects.requireNonNull(value, "operand value cannot be null");
        value.addUse(this);
    }

    public Operation getOwner() {
        return owner;
    }

    public int getOperandNumber() {
        return operandNumber;
    }

    void setOperandNumber(int operandNumber) {
        this.operandNumber = operandNumber;
    }

    public Value get() {
        return value;
    }

    /**
     * Points this operand at a new value, updating both use lists.
     */
    public void set(Value newValue) {
        Objects.requireNonNull(newValue, "operand value cannot be null");
        if (newValue == value) {
            return;
        }
        if (value != null) {
            value.removeUse(this);
        }
        value = newValue;
        newValue.addUse(this);
    }

    void drop() {
        if (value != null) {
            value.removeUse(this);
            value = null;
        }
    }

    boolean isDropped() {
        return value == null;
    }
}
