package flowscope.base.graph;

import static org.junit.jupiter.api.Assertions.*;

import flowscope.base.node.FunctionDefinition;
import flowscope.parser.SourceParser;
import flowscope.utils.Logging;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class CallGraphTest {

    private static final String SRC = """
            void a(int p) {
                b(0);
            }

            void b(int p) {
                c(1, 2);
            }

            void c(int p1, int p2) {
                a(0);
            }

            void d() {
                b(1);
                c(1, 2);
            }

            void e() {}
            """;

    @BeforeEach
    public void setUp() {
        Logging.init();
    }

    private static FunctionDefinition find(List<FunctionDefinition> funcs, String name) {
        for (var func : funcs) {
            if (func.getName().equals(name)) {
                return func;
            }
        }
        return null;
    }

    private static Set<String> names(Set<FunctionDefinition> funcs) {
        Set<String> result = new HashSet<>();
        funcs.forEach(f -> result.add(f.getName()));
        return result;
    }

    @Test
    public void testCallGraph() {
        var funcs = FunctionDefinition.collect(SourceParser.parse(SRC));
        var fa = find(funcs, "a");
        var fb = find(funcs, "b");
        var fc = find(funcs, "c");
        var fd = find(funcs, "d");
        var fe = find(funcs, "e");
        assert fa != null && fb != null && fc != null && fd != null && fe != null;

        var cg = CallGraph.build(funcs);
        assertEquals(cg.getNumNodes(), 5);
        assertTrue(cg.hasEdge(fa, fb));
        assertTrue(cg.hasEdge(fb, fc));
        assertTrue(cg.hasEdge(fc, fa));
        assertTrue(cg.hasEdge(fd, fb));
        assertTrue(cg.hasEdge(fd, fc));
        assertFalse(cg.hasEdge(fb, fa));
        assertTrue(cg.hasNode(fe));
        assertTrue(cg.neighbors(fe).isEmpty());

        assertEquals(names(cg.roots), Set.of("d", "e"));
        assertEquals(cg.leafNodes.size(), 1);
        assertTrue(cg.getFunctionNode(fe).isLeaf);

        assertTrue(cg.hasPath(fd, fa));
        assertTrue(cg.hasPath(fa, fc));
        assertFalse(cg.hasPath(fa, fd));
        assertFalse(cg.hasPath(fe, fa));

        var nodeC = cg.getFunctionNode(fc);
        assertEquals(cg.getCallers(nodeC).size(), 2);
        assertEquals(cg.getCallees(nodeC).size(), 1);
    }

    @Test
    public void testArityMismatch() {
        var cg = CallGraph.of(SourceParser.parse("""
                int add(int x, int y) { return x + y; }
                int caller(void) { return add(1); }
                """));
        var funcs = cg.getValues().stream().toList();
        assertFalse(cg.hasEdge(find(funcs, "caller"), find(funcs, "add")));
        assertEquals(cg.getNumNodes(), 2);
    }

    @Test
    public void testVariadicCallee() {
        var cg = CallGraph.of(SourceParser.parse("""
                void log_msg(int level, const char *fmt, ...) { }
                void one(void) { log_msg(1, "a"); }
                void many(void) { log_msg(1, "%d %d", 2, 3); }
                void few(void) { log_msg(1); }
                """));
        var funcs = cg.getValues().stream().toList();
        var log = find(funcs, "log_msg");
        assertTrue(cg.hasEdge(find(funcs, "one"), log));
        assertTrue(cg.hasEdge(find(funcs, "many"), log));
        assertFalse(cg.hasEdge(find(funcs, "few"), log));

        var logNode = cg.getFunctionNode(log);
        assertTrue(logNode.isVarArg);
        assertEquals(logNode.fixedParamNum, 2);
        assertTrue(cg.toGraphviz().contains("log_msg(...)"));
    }

    @Test
    public void testVoidParameterList() {
        var cg = CallGraph.of(SourceParser.parse("""
                int now(void) { return 0; }
                int tick(void) { return now() + 1; }
                int bad(void) { return now(1); }
                """));
        var funcs = cg.getValues().stream().toList();
        assertTrue(cg.hasEdge(find(funcs, "tick"), find(funcs, "now")));
        assertFalse(cg.hasEdge(find(funcs, "bad"), find(funcs, "now")));
    }

    @Test
    public void testIndirectCallsAreIgnored() {
        var cg = CallGraph.of(SourceParser.parse("""
                int fp(int v) { return v; }
                int run(int (*fp)(int)) { return (*fp)(1); }
                int direct(void) { return fp(2); }
                """));
        var funcs = cg.getValues().stream().toList();
        var fp = find(funcs, "fp");
        var run = find(funcs, "run");
        // same name and arity as the definition, but called through a pointer
        assertFalse(cg.hasEdge(run, fp));
        assertTrue(cg.neighbors(run).isEmpty());
        assertTrue(cg.getFunctionNode(run).callSites.isEmpty());
        assertTrue(cg.hasEdge(find(funcs, "direct"), fp));
    }

    @Test
    public void testSameNameEveryMatch() {
        var cg = CallGraph.of(SourceParser.parse("""
                static int helper(int x) { return x; }
                static int helper(int x) { return -x; }
                int use(void) { return helper(3); }
                """));
        var helpers = cg.getFunctionsByName("helper");
        assertEquals(helpers.size(), 2);
        var use = cg.getFunctionsByName("use").get(0);
        assertEquals(cg.neighbors(use), new HashSet<>(helpers));
    }

    @Test
    public void testRecursion() {
        var cg = CallGraph.of(SourceParser.parse("int fact(int n) { if (n <= 1) return 1; return n * fact(n - 1); }"));
        var fact = cg.getFunctionsByName("fact").get(0);
        assertTrue(cg.hasEdge(fact, fact));
        assertTrue(cg.roots.isEmpty());
        assertTrue(cg.leafNodes.isEmpty());
    }

    @Test
    public void testSupplementaryCharactersInSource() {
        var cg = CallGraph.of(SourceParser.parse(
                "/* \uD83D\uDE00 */\nvoid a(void) { puts(\"\uD83C\uDF89\"); b(); }\nvoid b(void) { }"));
        var funcs = cg.getValues().stream().toList();
        var fa = find(funcs, "a");
        var fb = find(funcs, "b");
        assertNotNull(fa);
        assertNotNull(fb);
        assertEquals(fa.getName(), "a");
        assertTrue(cg.hasEdge(fa, fb));

        var cfg = ControlFlowGraph.of(fa);
        var path = cfg.getExecutionPaths().get(0);
        assertEquals(path.get(0).toString(), "puts(\"\uD83C\uDF89\");");
        assertEquals(path.get(1).toString(), "b();");
    }

    @Test
    public void testGraphviz() {
        var dot = CallGraph.of(SourceParser.parse(SRC)).toGraphviz();
        assertTrue(dot.startsWith("digraph CallGraph {"));
        assertTrue(dot.contains("[label=\"e\"]"));
        assertEquals(dot.split("->").length - 1, 5);
    }
}
