package flowscope.base.constraint;

import flowscope.parser.NodeKind;
import flowscope.parser.SyntaxNode;
import flowscope.utils.AnalysisOptions;
import flowscope.utils.Logging;

import java.util.ArrayList;
import java.util.List;

/**
 * Decomposes a guard into the disjunctive normal form of atoms that make it
 * true. {@code ||} adds disjuncts, {@code &&} takes the cross product of its
 * operands' disjuncts, everything else (comparisons, calls, {@code !},
 * identifiers, ...) is one atom.
 * <p>
 * The result grows exponentially with nested {@code &&} over {@code ||};
 * {@link AnalysisOptions#maxConstraintDisjuncts} bounds it.
 */
public class EntryConstraintExtractor {
    private final int maxDisjuncts;

    public EntryConstraintExtractor(AnalysisOptions options) {
        this.maxDisjuncts = options.maxConstraintDisjuncts;
    }

    public EntryConstraintExtractor() {
        this(AnalysisOptions.defaults());
    }

    /**
     * @param condition guard expression, parenthesized or not
     * @return disjuncts, each an ordered conjunction of atomic sub-expressions
     */
    public List<List<SyntaxNode>> entryConstraints(SyntaxNode condition) {
        var result = decompose(condition);
        Logging.trace("EntryConstraints", String.format("%s -> %d disjunct(s)", condition.text(), result.size()));
        return result;
    }

    /** Atoms of the first disjunct present, by source text, in every disjunct */
    public List<SyntaxNode> commonEntryConstraints(SyntaxNode condition) {
        return commonOf(entryConstraints(condition));
    }

    public static List<SyntaxNode> commonOf(List<List<SyntaxNode>> disjuncts) {
        List<SyntaxNode> common = new ArrayList<>();
        if (disjuncts.isEmpty()) {
            return common;
        }
        for (var atom : disjuncts.get(0)) {
            if (disjuncts.stream().allMatch(conj -> containsText(conj, atom.text()))) {
                common.add(atom);
            }
        }
        return common;
    }

    private static boolean containsText(List<SyntaxNode> conjunction, String text) {
        for (var atom : conjunction) {
            if (atom.text().equals(text)) {
                return true;
            }
        }
        return false;
    }

    private List<List<SyntaxNode>> decompose(SyntaxNode expr) {
        if (expr.kind() == NodeKind.PARENTHESIZED_EXPRESSION) {
            var children = expr.children();
            if (children.size() != 1) {
                throw new MalformedConditionException(expr,
                        "expected one inner expression, found " + children.size());
            }
            return decompose(children.get(0));
        }

        if (expr.kind() == NodeKind.BINARY_EXPRESSION) {
            String op = expr.operator().orElse("");
            if (op.equals("||")) {
                var left = decompose(operand(expr, "left"));
                var right = decompose(operand(expr, "right"));
                checkLimit(expr, (long) left.size() + right.size());
                List<List<SyntaxNode>> result = new ArrayList<>(left);
                result.addAll(right);
                return result;
            }
            if (op.equals("&&")) {
                var left = decompose(operand(expr, "left"));
                var right = decompose(operand(expr, "right"));
                checkLimit(expr, (long) left.size() * right.size());
                List<List<SyntaxNode>> result = new ArrayList<>();
                for (var l : left) {
                    for (var r : right) {
                        List<SyntaxNode> conj = new ArrayList<>(l);
                        conj.addAll(r);
                        result.add(conj);
                    }
                }
                return result;
            }
        }

        List<List<SyntaxNode>> atom = new ArrayList<>();
        atom.add(List.of(expr));
        return atom;
    }

    private static SyntaxNode operand(SyntaxNode expr, String field) {
        return expr.childByField(field)
                .orElseThrow(() -> new MalformedConditionException(expr, "missing " + field + " operand"));
    }

    private void checkLimit(SyntaxNode expr, long required) {
        if (required > maxDisjuncts) {
            Logging.warn("EntryConstraints", "Disjunct limit exceeded by " + expr.text());
            throw new ConstraintLimitException(expr.text(), required, maxDisjuncts);
        }
    }
}
