package flowscope.base.node;

import flowscope.parser.SyntaxNode;

import java.util.List;
import java.util.Objects;

/**
 * One outcome of an {@code if} guard. The taken side keeps the DNF of the
 * guard computed when the {@code if} was rewritten.
 */
public class IfConditionNode extends FlowNode {
    public final SyntaxNode condition;
    public final boolean taken;
    private final List<List<SyntaxNode>> entryConstraints;
    private final List<SyntaxNode> commonEntryConstraints;

    public IfConditionNode(int handle, SyntaxNode condition, boolean taken,
                           List<List<SyntaxNode>> entryConstraints,
                           List<SyntaxNode> commonEntryConstraints) {
        super(handle);
        this.condition = condition;
        this.taken = taken;
        this.entryConstraints = List.copyOf(entryConstraints);
        this.commonEntryConstraints = List.copyOf(commonEntryConstraints);
    }

    /**
     * Disjuncts of conjunctions that make the guard true. Both sides carry
     * the decomposition of the same guard; on the N side none of them holds.
     */
    public List<List<SyntaxNode>> getEntryConstraints() {
        return entryConstraints;
    }

    public List<SyntaxNode> getCommonEntryConstraints() {
        return commonEntryConstraints;
    }

    @Override
    public boolean isSynthetic() {
        return true;
    }

    @Override
    public int hashCode() {
        return Objects.hash(condition.span(), taken);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof IfConditionNode other
                && taken == other.taken
                && condition.span().equals(other.condition.span());
    }

    @Override
    public String toString() {
        return "[if][" + (taken ? "Y" : "N") + "]" + condition.text();
    }
}
