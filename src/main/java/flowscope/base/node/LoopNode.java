package flowscope.base.node;

import flowscope.parser.SyntaxNode;

import java.util.Objects;

/**
 * Enter ({@code Y}) or skip ({@code N}) of a {@code for} or {@code while}.
 */
public class LoopNode extends FlowNode {
    public enum LoopKind {
        FOR,
        WHILE,
    }

    public final LoopKind loopKind;
    public final SyntaxNode loop;
    public final boolean taken;

    public LoopNode(int handle, LoopKind loopKind, SyntaxNode loop, boolean taken) {
        super(handle);
        this.loopKind = loopKind;
        this.loop = loop;
        this.taken = taken;
    }

    /** The loop head as printed, e.g. {@code ((b < 10))} or {@code (int i = 0; i < 10; i++)} */
    public String getHeader() {
        if (loopKind == LoopKind.WHILE) {
            return "(" + loop.childByField("condition").map(SyntaxNode::text).orElse("") + ")";
        }
        String init = loop.childByField("initializer").map(SyntaxNode::text).orElse("");
        if (init.endsWith(";")) {
            init = init.substring(0, init.length() - 1);
        }
        String cond = loop.childByField("condition").map(SyntaxNode::text).orElse("");
        String update = loop.childByField("update").map(SyntaxNode::text).orElse("");
        return "(" + init + "; " + cond + "; " + update + ")";
    }

    @Override
    public boolean isSynthetic() {
        return true;
    }

    @Override
    public int hashCode() {
        return Objects.hash(loopKind, loop.span(), taken);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof LoopNode other
                && loopKind == other.loopKind
                && taken == other.taken
                && loop.span().equals(other.loop.span());
    }

    @Override
    public String toString() {
        String kind = loopKind == LoopKind.FOR ? "for" : "while";
        return "[" + kind + "][" + (taken ? "Y" : "N") + "]" + getHeader();
    }
}
