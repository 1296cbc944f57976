package io.surfworks.warplayout.pattern;

import io.surfworks.warplayout.ir.Opcode;
import io.surfworks.warplayout.ir.Operation;

/**
 * A local rewrite rooted at one kind of operation.
 *
 * <p>A RewritePattern defines:
 * <ul>
 *   <li>A name identifying the pattern</li>
 *   <li>The opcode of the operations it is tried on</li>
 *   <li>A benefit used to order patterns sharing a root</li>
 *   <li>A combined match-and-rewrite step</li>
 * </ul>
 *
 * <p>Patterns are applied by {@link GreedyPatternDriver}, which offers every
 * live operation to the patterns rooted at its opcode until none applies.
 *
 * <p>Example implementation:
 * <pre>{@code
 * public final class FoldIdentityConversion implements RewritePattern {
 *     @Override
 *     public String name() { return "fold-identity-conversion"; }
 *
 *     @Override
 *     public Opcode rootOpcode() { return Opcode.CONVERT_LAYOUT; }
 *
 *     @Override
 *     public boolean matchAndRewrite(Operation op, PatternRewriter rewriter) {
 *         if (!op.getOperand(0).getType().equals(op.getResult(0).getType())) return false;
 *         rewriter.replaceOp(op, op.getOperand(0));
 *         return true;
 *     }
 * }
 * }</pre>
 */
public interface RewritePattern {

    /**
     * Returns the unique name of this pattern, used in logging and statistics.
     */
    String name();

    /**
     * Returns the opcode of the operations this pattern is rooted at.
     */
    Opcode rootOpcode();

    /**
     * Returns the benefit of this pattern. Patterns with a higher benefit are tried first.
     *
     * @return the benefit (default 1)
     */
    default int benefit() {
        return 1;
    }

    /**
     * Checks whether the pattern applies at {@code op} and, if so, rewrites the IR.
     *
     * <p>A pattern that returns false must leave the IR untouched.
     *
     * @param op an operation whose opcode is {@link #rootOpcode()}
     * @param rewriter the rewriter to create and replace operations with
     * @return true if the IR changed
     */
    boolean matchAndRewrite(Operation op, PatternRewriter rewriter);

    /**
     * Returns a human-readable description of what this pattern does.
     */
    default String description() {
        return name() + " rewrite pattern";
    }
}
