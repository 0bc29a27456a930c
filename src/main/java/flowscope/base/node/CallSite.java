package flowscope.base.node;

import flowscope.parser.NodeKind;
import flowscope.parser.SyntaxNode;

import java.util.List;
import java.util.Optional;

/**
 * A {@code call_expression} inside a function body.
 */
public class CallSite {
    public final FunctionDefinition caller;
    public final SyntaxNode callExpr;
    public final SyntaxNode callee;
    public final List<SyntaxNode> arguments;

    public CallSite(FunctionDefinition caller, SyntaxNode callExpr) {
        if (!callExpr.is(NodeKind.CALL_EXPRESSION)) {
            throw new IllegalArgumentException("Not a call expression: " + callExpr.kind());
        }
        this.caller = caller;
        this.callExpr = callExpr;
        this.callee = callExpr.childByField("function")
                .orElseThrow(() -> new IllegalArgumentException("Call without callee: " + callExpr.text()));
        this.arguments = callExpr.childByField("arguments")
                .map(SyntaxNode::children)
                .orElse(List.of());
    }

    /** Anything but a bare identifier, e.g. {@code (*fp)(x)} or {@code ops->run(x)} */
    public boolean isIndirect() {
        return !callee.is(NodeKind.IDENTIFIER);
    }

    public Optional<String> getCalleeName() {
        return isIndirect() ? Optional.empty() : Optional.of(callee.text());
    }

    public int getArgumentCount() {
        return arguments.size();
    }

    @Override
    public String toString() {
        return String.format("CallSite{%s @ %s}", callExpr.text(), callExpr.span());
    }

    @Override
    public int hashCode() {
        return callExpr.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof CallSite other)) {
            return false;
        }
        return this.callExpr.equals(other.callExpr);
    }
}
