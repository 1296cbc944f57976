package io.surfworks.warplayout.ir;

import java.util.List;

/**
 * Thrown when {@link IrVerifier} finds structural problems in a module.
 */
public class IrVerificationException extends RuntimeException {

    private final List<String> problems;

    public IrVerificationException(List<String> problems) {
        super(format(problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }

    private static String format(List<String> problems) {
        StringBuilder sb = new StringBuilder("IR verification failed:\n");
        for (String problem : problems) {
            sb.append("  - ").append(problem).append("\n");
        }
        return sb.toString();
    }
}
