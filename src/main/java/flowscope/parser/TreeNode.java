package flowscope.parser;

import java.util.*;

/**
 * The {@link SyntaxNode} built by {@link SyntaxTreeBuilder}. Nodes are
 * created once per parse and never mutated after the builder returns.
 */
public class TreeNode implements SyntaxNode {
    private final NodeKind kind;
    private final Span span;
    private final String source;
    private final List<SyntaxNode> children = new ArrayList<>();
    private final Map<String, SyntaxNode> fields = new HashMap<>();
    private String operator;
    private TreeNode parent;

    TreeNode(NodeKind kind, Span span, String source) {
        this.kind = kind;
        this.span = span;
        this.source = source;
    }

    TreeNode addChild(TreeNode child) {
        if (child == null) {
            return this;
        }
        child.parent = this;
        children.add(child);
        return this;
    }

    /** Add the child and register it under the field name */
    TreeNode addField(String field, TreeNode child) {
        if (child == null) {
            return this;
        }
        addChild(child);
        fields.put(field, child);
        return this;
    }

    /** Register an already added child under an additional field name */
    TreeNode markField(String field, TreeNode child) {
        if (child != null) {
            fields.put(field, child);
        }
        return this;
    }

    TreeNode setOperator(String operator) {
        this.operator = operator;
        return this;
    }

    @Override
    public NodeKind kind() {
        return kind;
    }

    @Override
    public List<SyntaxNode> children() {
        return Collections.unmodifiableList(children);
    }

    @Override
    public Optional<SyntaxNode> childByField(String field) {
        return Optional.ofNullable(fields.get(field));
    }

    @Override
    public List<SyntaxNode> descendantsOfKind(NodeKind... kinds) {
        Set<NodeKind> wanted = kinds.length == 0
                ? EnumSet.noneOf(NodeKind.class)
                : EnumSet.copyOf(Arrays.asList(kinds));
        List<SyntaxNode> result = new ArrayList<>();
        Deque<SyntaxNode> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            SyntaxNode cur = stack.pop();
            if (wanted.contains(cur.kind())) {
                result.add(cur);
            }
            List<SyntaxNode> curChildren = cur.children();
            for (int i = curChildren.size() - 1; i >= 0; i--) {
                stack.push(curChildren.get(i));
            }
        }
        return result;
    }

    @Override
    public Span span() {
        return span;
    }

    @Override
    public String text() {
        return source.substring(span.startOffset, span.endOffset);
    }

    @Override
    public Optional<String> operator() {
        return Optional.ofNullable(operator);
    }

    @Override
    public Optional<SyntaxNode> parent() {
        return Optional.ofNullable(parent);
    }

    /**
     * Render the subtree as an indented S-expression, mainly for debugging
     * the front end.
     */
    public String dumpTree() {
        StringBuilder builder = new StringBuilder();
        dumpTree(this, builder, 0);
        return builder.toString();
    }

    private static void dumpTree(SyntaxNode node, StringBuilder builder, int depth) {
        builder.append("  ".repeat(depth)).append('(').append(node.kind().typeName());
        if (node.children().isEmpty()) {
            builder.append(" \"").append(node.text()).append('"');
        }
        builder.append(")\n");
        for (var child : node.children()) {
            dumpTree(child, builder, depth + 1);
        }
    }

    @Override
    public String toString() {
        return text();
    }
}
