package io.surfworks.warplayout.analysis;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import io.surfworks.warplayout.ir.Block;
import io.surfworks.warplayout.ir.Operation;

/**
 * Orders operations of one function so that definitions come before their uses.
 *
 * <p>With structured control flow program order is such an order: an operation
 * is placed by the path of positions leading to it from the function body, and
 * paths compare lexicographically, so a region-holding operation precedes
 * everything nested in it.
 */
public final class TopologicalOrder {

    private TopologicalOrder() {}

    public static List<Operation> sort(Collection<Operation> ops) {
        Map<Operation, List<Integer>> paths = new HashMap<>();
        for (Operation op : ops) {
            paths.put(op, pathOf(op));
        }
        List<Operation> sorted = new ArrayList<>(paths.keySet());
        sorted.sort(Comparator.comparing(paths::get, TopologicalOrder::compare));
        return sorted;
    }

    private static List<Integer> pathOf(Operation op) {
        List<Integer> path = new ArrayList<>();
        Operation current = op;
        while (current != null) {
            Block block = current.getBlock();
            if (block == null) {
                throw new IllegalArgumentException("Operation " + current.getOpcode() + " is not in a block");
            }
            path.add(0, block.indexOf(current));
            Operation parent = block.getParentOp();
            if (parent != null) {
                path.add(0, parent.getRegions().indexOf(block.getParent()));
            }
            current = parent;
        }
        return path;
    }

    private static int compare(List<Integer> a, List<Integer> b) {
        int n = Math.min(a.size(), b.size());
        for (int i = 0; i < n; i++) {
            int c = Integer.compare(a.get(i), b.get(i));
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(a.size(), b.size());
    }
}
