package io.surfworks.warplayout.ir;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * A function: a name and a body region whose entry block arguments are the parameters.
 */
public final class Function {

    private final String name;
    private final Region body;
    private final boolean isPublic;

    public Function(String name, List<Type> parameterTypes, boolean isPublic) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.body = new Region(null);
        this.isPublic = isPublic;
        for (Type t : parameterTypes) {
            body.getBlock().addArgument(t);
        }
    }

    public Function(String name, List<Type> parameterTypes) {
        this(name, parameterTypes, true);
    }

    public String name() {
        return name;
    }

    public boolean isPublic() {
        return isPublic;
    }

    public Region getBody() {
        return body;
    }

    public Block getEntryBlock() {
        return body.getBlock();
    }

    public List<BlockArgument> getArguments() {
        return getEntryBlock().getArguments();
    }

    public BlockArgument getArgument(int index) {
        return getEntryBlock().getArgument(index);
    }

    /**
     * Visits every operation in the body, in program order (parents before nested ops).
     */
    public void walk(Consumer<Operation> visitor) {
        body.walk(visitor);
    }

    /**
     * Collects every operation with the given opcode, in program order.
     */
    public List<Operation> collect(Opcode opcode) {
        List<Operation> found = new ArrayList<>();
        walk(op -> {
            if (op.is(opcode)) {
                found.add(op);
            }
        });
        return found;
    }

    @Override
    public String toString() {
        return String.format("Function[%s, params=%d, ops=%d]",
                name, getArguments().size(), getEntryBlock().size());
    }
}
