package flowscope.base.node;

import flowscope.parser.NodeKind;
import flowscope.parser.SyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Typed view over a {@code function_definition} node.
 */
public class FunctionDefinition {
    private final SyntaxNode node;
    private final SyntaxNode functionDeclarator;
    private final String name;

    public FunctionDefinition(SyntaxNode node) {
        if (!node.is(NodeKind.FUNCTION_DEFINITION)) {
            throw new IllegalArgumentException("Not a function definition: " + node.kind());
        }
        this.node = node;
        this.functionDeclarator = findFunctionDeclarator(node)
                .orElseThrow(() -> new IllegalArgumentException("Function without declarator at " + node.span()));
        this.name = declaredName(functionDeclarator)
                .orElseThrow(() -> new IllegalArgumentException("Function without name at " + node.span()));
    }

    /** All function definitions under {@code root}, in source order */
    public static List<FunctionDefinition> collect(SyntaxNode root) {
        List<FunctionDefinition> result = new ArrayList<>();
        for (var def : root.descendantsOfKind(NodeKind.FUNCTION_DEFINITION)) {
            result.add(new FunctionDefinition(def));
        }
        return result;
    }

    /**
     * The declarator of {@code int *(*f(int))[3]} is nested several levels
     * deep; the function declarator is the first one met going inwards.
     */
    private static Optional<SyntaxNode> findFunctionDeclarator(SyntaxNode def) {
        var cur = def.childByField("declarator");
        while (cur.isPresent()) {
            var decl = cur.get();
            if (decl.is(NodeKind.FUNCTION_DECLARATOR)) {
                return cur;
            }
            cur = decl.childByField("declarator");
        }
        return Optional.empty();
    }

    private static Optional<String> declaredName(SyntaxNode declarator) {
        var cur = declarator.childByField("declarator");
        while (cur.isPresent()) {
            var decl = cur.get();
            if (decl.is(NodeKind.IDENTIFIER)) {
                return Optional.of(decl.text());
            }
            cur = decl.childByField("declarator");
        }
        return Optional.empty();
    }

    public SyntaxNode getNode() {
        return node;
    }

    public String getName() {
        return name;
    }

    public List<SyntaxNode> getParameters() {
        List<SyntaxNode> params = new ArrayList<>();
        functionDeclarator.childByField("parameters").ifPresent(list -> {
            for (var child : list.children()) {
                if (child.is(NodeKind.PARAMETER_DECLARATION)) {
                    params.add(child);
                }
            }
        });
        return params;
    }

    public boolean isVariadic() {
        return functionDeclarator.childByField("parameters")
                .map(list -> list.children().stream().anyMatch(c -> c.is(NodeKind.VARIADIC_PARAMETER)))
                .orElse(false);
    }

    /**
     * Number of named parameters before any {@code ...}. A lone unnamed
     * {@code void} parameter declares none.
     */
    public int fixedParamNum() {
        var params = getParameters();
        if (params.size() == 1 && isVoidParameter(params.get(0))) {
            return 0;
        }
        return params.size();
    }

    private static boolean isVoidParameter(SyntaxNode param) {
        boolean voidType = param.childByField("type")
                .map(t -> t.is(NodeKind.PRIMITIVE_TYPE) && t.text().equals("void"))
                .orElse(false);
        return voidType && param.childByField("declarator").isEmpty();
    }

    public SyntaxNode getBody() {
        return node.childByField("body")
                .orElseThrow(() -> new IllegalStateException("Function without body: " + name));
    }

    /** Statements of the body, braces excluded */
    public List<SyntaxNode> getBodyStatements() {
        return getBody().children();
    }

    public boolean isStatic() {
        return hasSpecifier(NodeKind.STORAGE_CLASS_SPECIFIER, "static");
    }

    public boolean isInline() {
        return node.children().stream()
                .anyMatch(c -> c.is(NodeKind.FUNCTION_SPECIFIER) && c.text().contains("inline"));
    }

    private boolean hasSpecifier(NodeKind kind, String text) {
        return node.children().stream().anyMatch(c -> c.is(kind) && c.text().equals(text));
    }

    public List<CallSite> callSites() {
        List<CallSite> result = new ArrayList<>();
        for (var call : getBody().descendantsOfKind(NodeKind.CALL_EXPRESSION)) {
            result.add(new CallSite(this, call));
        }
        return result;
    }

    @Override
    public int hashCode() {
        return node.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof FunctionDefinition other)) {
            return false;
        }
        return node.equals(other.node);
    }

    @Override
    public String toString() {
        return name;
    }
}
