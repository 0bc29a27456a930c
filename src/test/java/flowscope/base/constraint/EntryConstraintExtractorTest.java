package flowscope.base.constraint;

import static org.mockito.Mockito.*;
import static org.junit.jupiter.api.Assertions.*;

import flowscope.parser.NodeKind;
import flowscope.parser.SourceParser;
import flowscope.parser.SyntaxNode;
import flowscope.utils.AnalysisOptions;
import flowscope.utils.Logging;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

@ExtendWith(MockitoExtension.class)
public class EntryConstraintExtractorTest {
    @Mock
    private SyntaxNode mockParenthesized;
    @Mock
    private SyntaxNode mockInner1;
    @Mock
    private SyntaxNode mockInner2;

    private EntryConstraintExtractor extractor;

    @BeforeEach
    public void setUp() {
        Logging.init();
        extractor = new EntryConstraintExtractor();
    }

    private static SyntaxNode condition(String guard) {
        var root = SourceParser.parse("if " + guard + " { x = 1; }");
        return root.descendantsOfKind(NodeKind.IF_STATEMENT).get(0).childByField("condition").orElseThrow();
    }

    private static List<List<String>> texts(List<List<SyntaxNode>> disjuncts) {
        List<List<String>> result = new ArrayList<>();
        for (var conj : disjuncts) {
            List<String> atoms = new ArrayList<>();
            conj.forEach(atom -> atoms.add(atom.text()));
            result.add(atoms);
        }
        return result;
    }

    @Test
    public void testOrOfAnd() {
        var cond = condition("((a > 10 && b < 20) || b == 20)");
        var disjuncts = extractor.entryConstraints(cond);
        assertEquals(texts(disjuncts), List.of(
                List.of("a > 10", "b < 20"),
                List.of("b == 20")));
        assertTrue(extractor.commonEntryConstraints(cond).isEmpty());
    }

    @Test
    public void testCrossProduct() {
        var cond = condition("((a || b) && (c || d))");
        assertEquals(texts(extractor.entryConstraints(cond)), List.of(
                List.of("a", "c"),
                List.of("a", "d"),
                List.of("b", "c"),
                List.of("b", "d")));
    }

    @Test
    public void testCommonConstraints() {
        var cond = condition("(x != 0 && (y || z > 1))");
        assertEquals(texts(extractor.entryConstraints(cond)), List.of(
                List.of("x != 0", "y"),
                List.of("x != 0", "z > 1")));
        var common = extractor.commonEntryConstraints(cond);
        assertEquals(common.size(), 1);
        assertEquals(common.get(0).text(), "x != 0");
    }

    @Test
    public void testOpaqueAtoms() {
        assertEquals(texts(extractor.entryConstraints(condition("(!ready(p))"))),
                List.of(List.of("!ready(p)")));
        assertEquals(texts(extractor.entryConstraints(condition("(flags & MASK)"))),
                List.of(List.of("flags & MASK")));
        // a comparison between parenthesized operands is still a single atom
        assertEquals(texts(extractor.entryConstraints(condition("((a || b) == c)"))),
                List.of(List.of("(a || b) == c")));
    }

    @Test
    public void testDisjunctLimit() {
        var options = AnalysisOptions.defaults();
        options.maxConstraintDisjuncts = 3;
        var limited = new EntryConstraintExtractor(options);
        var cond = condition("((a || b) && (c || d))");
        var e = assertThrows(ConstraintLimitException.class, () -> limited.entryConstraints(cond));
        assertEquals(e.limit, 3);

        // within the limit
        assertEquals(limited.entryConstraints(condition("(a || b || c)")).size(), 3);
    }

    @Test
    public void testMalformedParenthesized() {
        when(mockParenthesized.kind()).thenReturn(NodeKind.PARENTHESIZED_EXPRESSION);
        when(mockParenthesized.children()).thenReturn(List.of(mockInner1, mockInner2));
        when(mockParenthesized.text()).thenReturn("(a b)");

        var e = assertThrows(MalformedConditionException.class,
                () -> extractor.entryConstraints(mockParenthesized));
        assertTrue(e.getMessage().contains("(a b)"));
    }
}
