package flowscope.base.graph;

import static org.junit.jupiter.api.Assertions.*;

import flowscope.base.node.FlowNode;
import flowscope.base.node.FunctionDefinition;
import flowscope.base.node.IfConditionNode;
import flowscope.base.node.SwitchNode;
import flowscope.base.node.UnsupportedStatementException;
import flowscope.parser.SourceParser;
import flowscope.parser.SyntaxNode;
import flowscope.utils.AnalysisOptions;
import flowscope.utils.Logging;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.*;

public class ControlFlowGraphTest {

    private static final String SRC1 = """
            void a(int p) {
                int b = 1;
                while (b < 10) {
                    b++;
                    if (b == 8) {
                        goto label1;
                    }
                }
                for (int i = 0; i < 10; i++) {
                    b--;
                }
                return;
            label1:
                printf("6");
                return;
            }
            """;

    private static final String SRC2 = """
            int b = 1;
            do {
                if (b == 1) {
                    c(0);
                } else if (b == 2) {
                    c(2);
                } else {
                    c(3);
                }
            } while (b < 10);

            if (b == 1) {
                printf("6");
            }
            """;

    @BeforeAll
    public static void setUp() {
        Logging.init();
    }

    private static ControlFlowGraph functionCfg(String src) {
        var func = FunctionDefinition.collect(SourceParser.parse(src)).get(0);
        return ControlFlowGraph.of(func);
    }

    private static ControlFlowGraph statementsCfg(String src) {
        return ControlFlowGraph.build(SourceParser.parse(src).children());
    }

    private static List<String> render(List<FlowNode> path) {
        List<String> result = new ArrayList<>();
        path.forEach(node -> result.add(node.toString()));
        return result;
    }

    private static Set<List<String>> renderAll(List<List<FlowNode>> paths) {
        Set<List<String>> result = new HashSet<>();
        paths.forEach(path -> result.add(render(path)));
        return result;
    }

    @Test
    public void testStraightLine() {
        var cfg = functionCfg("void f(void) { int x = 0; x = x + 1; g(x); }");
        var paths = cfg.getExecutionPaths();
        assertEquals(paths.size(), 1);
        assertEquals(render(paths.get(0)), List.of("int x = 0;", "x = x + 1;", "g(x);"));
    }

    @Test
    public void testIfElse() {
        var cfg = statementsCfg("if (c > 0) { a = 1; } else { a = 2; }");
        assertEquals(renderAll(cfg.getExecutionPaths()), Set.of(
                List.of("[if][Y](c > 0)", "a = 1;"),
                List.of("[if][N](c > 0)", "a = 2;")));
    }

    @Test
    public void testIfWithoutElse() {
        var cfg = statementsCfg("if (c) a(); b();");
        assertEquals(renderAll(cfg.getExecutionPaths()), Set.of(
                List.of("[if][Y](c)", "a();", "b();"),
                List.of("[if][N](c)", "b();")));
    }

    @Test
    public void testLoopsHaveNoBackEdge() {
        var whileCfg = statementsCfg("while (i < n) { i++; } done();");
        assertEquals(renderAll(whileCfg.getExecutionPaths()), Set.of(
                List.of("[while][Y]((i < n))", "i++;", "done();"),
                List.of("[while][N]((i < n))", "done();")));

        var forCfg = statementsCfg("for (i = 0; i < n; i++) sum += i;");
        assertEquals(renderAll(forCfg.getExecutionPaths()), Set.of(
                List.of("[for][Y](i = 0; i < n; i++)", "sum += i;"),
                List.of("[for][N](i = 0; i < n; i++)")));
    }

    @Test
    public void testFunctionWithGotoAndReturns() {
        var cfg = functionCfg(SRC1);
        var paths = cfg.getExecutionPaths();
        assertEquals(paths.size(), 5);
        assertEquals(renderAll(paths), Set.of(
                List.of("int b = 1;", "[while][Y]((b < 10))", "b++;", "[if][Y](b == 8)",
                        "goto label1;", "printf(\"6\");", "return;"),
                List.of("int b = 1;", "[while][Y]((b < 10))", "b++;", "[if][N](b == 8)",
                        "[for][Y](int i = 0; i < 10; i++)", "b--;", "return;"),
                List.of("int b = 1;", "[while][Y]((b < 10))", "b++;", "[if][N](b == 8)",
                        "[for][N](int i = 0; i < 10; i++)", "return;"),
                List.of("int b = 1;", "[while][N]((b < 10))",
                        "[for][Y](int i = 0; i < 10; i++)", "b--;", "return;"),
                List.of("int b = 1;", "[while][N]((b < 10))",
                        "[for][N](int i = 0; i < 10; i++)", "return;")));

        var labels = cfg.getLabels();
        assertEquals(labels.keySet(), Set.of("label1"));
        assertEquals(render(labels.get("label1")), List.of("printf(\"6\");"));
    }

    @Test
    public void testTopLevelStatements() {
        var cfg = statementsCfg(SRC2);
        var paths = cfg.getExecutionPaths();
        assertEquals(paths.size(), 6);
        assertEquals(renderAll(paths), Set.of(
                List.of("int b = 1;", "[if][Y](b == 1)", "c(0);", "[do-while][]((b < 10))",
                        "[if][Y](b == 1)", "printf(\"6\");"),
                List.of("int b = 1;", "[if][Y](b == 1)", "c(0);", "[do-while][]((b < 10))",
                        "[if][N](b == 1)"),
                List.of("int b = 1;", "[if][N](b == 1)", "[if][Y](b == 2)", "c(2);",
                        "[do-while][]((b < 10))", "[if][Y](b == 1)", "printf(\"6\");"),
                List.of("int b = 1;", "[if][N](b == 1)", "[if][Y](b == 2)", "c(2);",
                        "[do-while][]((b < 10))", "[if][N](b == 1)"),
                List.of("int b = 1;", "[if][N](b == 1)", "[if][N](b == 2)", "c(3);",
                        "[do-while][]((b < 10))", "[if][Y](b == 1)", "printf(\"6\");"),
                List.of("int b = 1;", "[if][N](b == 1)", "[if][N](b == 2)", "c(3);",
                        "[do-while][]((b < 10))", "[if][N](b == 1)")));
    }

    @Test
    public void testSentinelsAndReachability() {
        var cfg = statementsCfg(SRC2);
        var start = cfg.getStart();
        var end = cfg.getEnd();
        assertTrue(cfg.getPredecessors(start).isEmpty());
        assertTrue(cfg.getSuccessors(end).isEmpty());
        assertTrue(cfg.containsNode(start));
        assertTrue(cfg.containsNode(end));

        Set<FlowNode> reached = new HashSet<>();
        Deque<FlowNode> workList = new ArrayDeque<>();
        workList.add(start);
        reached.add(start);
        while (!workList.isEmpty()) {
            for (var succ : cfg.getSuccessors(workList.poll())) {
                if (reached.add(succ)) {
                    workList.add(succ);
                }
            }
        }
        assertEquals(reached, cfg.getNodes());
    }

    @Test
    public void testEmptyInput() {
        var cfg = ControlFlowGraph.build(List.of());
        assertEquals(cfg.getNumNodes(), 2);
        assertTrue(cfg.hasEdge(cfg.getStart(), cfg.getEnd()));
        var paths = cfg.getExecutionPaths();
        assertEquals(paths.size(), 1);
        assertTrue(paths.get(0).isEmpty());

        var emptyBody = functionCfg("void f(void) { { } }");
        assertEquals(emptyBody.getNumNodes(), 2);
    }

    @Test
    public void testSwitchWithoutFallthrough() {
        var cfg = statementsCfg("""
                switch (x) {
                case 1:
                    a();
                    break;
                case 2:
                    b();
                default:
                    c();
                }
                d();
                """);
        assertEquals(renderAll(cfg.getExecutionPaths()), Set.of(
                List.of("[switch](x)[case 1]", "a();", "break;", "d();"),
                List.of("[switch](x)[case 2]", "b();", "d();"),
                List.of("[switch](x)[default]", "c();", "d();")));

        int defaults = 0;
        for (var node : cfg.getNodes()) {
            if (node instanceof SwitchNode switchNode && switchNode.isDefault()) {
                defaults++;
                assertEquals(switchNode.getCaseBody().size(), 1);
            }
        }
        assertEquals(defaults, 1);
    }

    @Test
    public void testGotoToRewrittenLabel() {
        var cfg = functionCfg("""
                void f(int c) {
                    goto l;
                    skipped();
                l:  if (c) a();
                    b();
                }
                """);
        assertEquals(render(cfg.getLabels().get("l")), List.of("[if][Y](c)", "[if][N](c)"));
        assertEquals(renderAll(cfg.getExecutionPaths()), Set.of(
                List.of("goto l;", "[if][Y](c)", "a();", "b();"),
                List.of("goto l;", "[if][N](c)", "b();")));
    }

    @Test
    public void testBackwardGotoCycle() {
        var cfg = functionCfg("""
                void f(int c) {
                again:
                    x = 1;
                    if (c) goto again;
                    return;
                }
                """);
        FlowNode gotoNode = null;
        FlowNode target = null;
        for (var node : cfg.getNodes()) {
            if (node.toString().equals("goto again;")) {
                gotoNode = node;
            }
            if (node.toString().equals("x = 1;")) {
                target = node;
            }
        }
        assertNotNull(gotoNode);
        assertTrue(cfg.hasEdge(gotoNode, target));
        assertEquals(cfg.getSuccessors(gotoNode).size(), 1);

        // simple paths never go around the cycle
        assertEquals(renderAll(cfg.getExecutionPaths()), Set.of(
                List.of("x = 1;", "[if][N](c)", "return;")));
    }

    @Test
    public void testMissingLabel() {
        var e = assertThrows(MissingLabelException.class,
                () -> functionCfg("void f(void) { goto nowhere; }"));
        assertEquals(e.label, "nowhere");
    }

    @Test
    public void testUnsupportedStatement() {
        // a case label outside of any switch
        assertThrows(UnsupportedStatementException.class,
                () -> functionCfg("void f(int x) { case 1: x = 0; }"));

        var root = SourceParser.parse("void g(void) { }");
        List<SyntaxNode> statements = root.children();
        assertThrows(UnsupportedStatementException.class, () -> ControlFlowGraph.build(statements));
    }

    @Test
    public void testIfNodeCarriesEntryConstraints() {
        var cfg = statementsCfg("if ((a > 10 && b < 20) || b == 20) { x = 1; }");
        IfConditionNode yes = null;
        IfConditionNode no = null;
        for (var node : cfg.getNodes()) {
            if (node instanceof IfConditionNode ifNode) {
                if (ifNode.taken) {
                    yes = ifNode;
                } else {
                    no = ifNode;
                }
            }
        }
        assertNotNull(yes);
        assertNotNull(no);
        assertEquals(yes.getEntryConstraints().size(), 2);
        assertEquals(yes.getEntryConstraints().get(0).size(), 2);
        assertTrue(yes.getCommonEntryConstraints().isEmpty());
        // the N side describes the same guard
        assertEquals(no.getEntryConstraints().size(), 2);
        assertEquals(no.getEntryConstraints().get(1).get(0).text(), "b == 20");
        assertNotEquals(yes, no);
    }

    private static Set<List<FlowNode>> edges(ControlFlowGraph cfg) {
        Set<List<FlowNode>> result = new HashSet<>();
        for (var node : cfg.getNodes()) {
            for (var succ : cfg.getSuccessors(node)) {
                result.add(List.of(node, succ));
            }
        }
        return result;
    }

    @Test
    public void testDeterministic() {
        var first = functionCfg(SRC1);
        var second = functionCfg(SRC1);
        assertEquals(first.getNodes(), second.getNodes());
        assertEquals(edges(first), edges(second));
        assertEquals(first.getNumEdges(), second.getNumEdges());
        assertEquals(first.toGraphviz(), second.toGraphviz());
        assertEquals(first.getExecutionPaths(), second.getExecutionPaths());

        var guarded = "void f(int c) { a(); if (c) b(); }";
        var third = functionCfg(guarded);
        var fourth = functionCfg(guarded);
        assertEquals(third.getNodes(), fourth.getNodes());
        assertEquals(edges(third), edges(fourth));
        assertEquals(new HashSet<>(third.getExecutionPaths()), new HashSet<>(fourth.getExecutionPaths()));
        assertNotEquals(first.getNodes(), third.getNodes());
    }

    @Test
    public void testBasicBlocks() {
        var cfg = functionCfg("void f(void) { int x = 0; x = x + 1; g(x); }");
        var blocks = cfg.getBasicBlocks();
        assertEquals(blocks.size(), 3);
        assertEquals(blocks.get(0).getLeader(), cfg.getStart());
        assertEquals(render(blocks.get(1).getNodes()), List.of("int x = 0;", "x = x + 1;", "g(x);"));
        assertEquals(blocks.get(2).getLeader(), cfg.getEnd());

        var branchy = statementsCfg(SRC2);
        int covered = 0;
        for (var block : branchy.getBasicBlocks()) {
            covered += block.size();
        }
        assertEquals(covered, branchy.getNumNodes());
        // merging does not touch the graph
        assertEquals(branchy.getExecutionPaths().size(), 6);
    }

    @Test
    public void testMaxPathLength() {
        var options = AnalysisOptions.defaults();
        options.maxPathLength = 2;
        var func = FunctionDefinition.collect(SourceParser.parse("void f(void) { a(); b(); c(); }")).get(0);
        assertTrue(ControlFlowGraph.of(func, options).getExecutionPaths().isEmpty());

        options.maxPathLength = 4;
        assertEquals(ControlFlowGraph.of(func, options).getExecutionPaths().size(), 1);
    }

    @Test
    public void testGraphviz() {
        var dot = statementsCfg("if (c) a();").toGraphviz("demo");
        assertTrue(dot.startsWith("digraph demo {"));
        assertTrue(dot.contains("<START>"));
        assertTrue(dot.contains("[if][Y](c)"));
        assertTrue(dot.endsWith("}"));
    }
}
