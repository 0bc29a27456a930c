package flowscope.base.node;

import flowscope.parser.SyntaxNode;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Dispatch of a {@code switch} to one of its {@code case}/{@code default} labels.
 */
public class SwitchNode extends FlowNode {
    public final SyntaxNode switchStatement;
    public final SyntaxNode caseStatement;

    public SwitchNode(int handle, SyntaxNode switchStatement, SyntaxNode caseStatement) {
        super(handle);
        this.switchStatement = switchStatement;
        this.caseStatement = caseStatement;
    }

    public String getCondition() {
        return switchStatement.childByField("condition").map(SyntaxNode::text).orElse("()");
    }

    /** Empty for {@code default} */
    public Optional<SyntaxNode> getCaseValue() {
        return caseStatement.childByField("value");
    }

    public boolean isDefault() {
        return getCaseValue().isEmpty();
    }

    /** Statements under the label, up to the next label */
    public List<SyntaxNode> getCaseBody() {
        var value = getCaseValue();
        return caseStatement.children().stream()
                .filter(child -> value.isEmpty() || child != value.get())
                .toList();
    }

    @Override
    public boolean isSynthetic() {
        return true;
    }

    @Override
    public int hashCode() {
        return Objects.hash(switchStatement.span(), caseStatement.span());
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof SwitchNode other
                && switchStatement.span().equals(other.switchStatement.span())
                && caseStatement.span().equals(other.caseStatement.span());
    }

    @Override
    public String toString() {
        String label = getCaseValue().map(v -> "[case " + v.text() + "]").orElse("[default]");
        return "[switch]" + getCondition() + label;
    }
}
