package io.surfworks.warplayout.ir.layout;

import java.util.List;

final class Layouts {

    private Layouts() {}

    static String formatList(List<Integer> list) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < list.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(list.get(i));
        }
        sb.append("]");
        return sb.toString();
    }

    static List<Integer> requireNonEmpty(List<Integer> list, String name) {
        if (list == null || list.isEmpty()) {
            throw new IllegalArgumentException(name + " cannot be empty");
        }
        return List.copyOf(list);
    }
}
