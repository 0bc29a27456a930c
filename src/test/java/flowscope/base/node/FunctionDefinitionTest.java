package flowscope.base.node;

import static org.junit.jupiter.api.Assertions.*;

import flowscope.parser.NodeKind;
import flowscope.parser.SourceParser;
import org.junit.jupiter.api.Test;

import java.util.List;

public class FunctionDefinitionTest {
    private static final String SRC = """
            static inline int *make(void) {
                return alloc(4);
            }

            int log_msg(const char *fmt, ...) {
                return vprint(fmt, 0);
            }

            void d() {
                b(1);
                c(1, 2);
            }

            int (apply)(int (*fn)(int), int v) {
                return (*fn)(v) + fn(v);
            }
            """;

    private static List<FunctionDefinition> functions() {
        return FunctionDefinition.collect(SourceParser.parse(SRC));
    }

    @Test
    public void testNames() {
        var funcs = functions();
        assertEquals(funcs.size(), 4);
        assertEquals(funcs.get(0).getName(), "make");
        assertEquals(funcs.get(1).getName(), "log_msg");
        assertEquals(funcs.get(2).getName(), "d");
        assertEquals(funcs.get(3).getName(), "apply");
    }

    @Test
    public void testParameters() {
        var funcs = functions();
        var make = funcs.get(0);
        assertEquals(make.getParameters().size(), 1);
        assertEquals(make.fixedParamNum(), 0);
        assertFalse(make.isVariadic());

        var logMsg = funcs.get(1);
        assertTrue(logMsg.isVariadic());
        assertEquals(logMsg.fixedParamNum(), 1);

        assertEquals(funcs.get(2).fixedParamNum(), 0);
        assertEquals(funcs.get(3).fixedParamNum(), 2);
    }

    @Test
    public void testSpecifiers() {
        var funcs = functions();
        assertTrue(funcs.get(0).isStatic());
        assertTrue(funcs.get(0).isInline());
        assertFalse(funcs.get(1).isStatic());
        assertFalse(funcs.get(1).isInline());
    }

    @Test
    public void testBodyAndCallSites() {
        var d = functions().get(2);
        assertEquals(d.getBodyStatements().size(), 2);
        assertEquals(d.getBody().kind(), NodeKind.COMPOUND_STATEMENT);

        var calls = d.callSites();
        assertEquals(calls.size(), 2);
        assertEquals(calls.get(0).getCalleeName().orElseThrow(), "b");
        assertEquals(calls.get(1).getArgumentCount(), 2);
        assertEquals(calls.get(1).caller, d);

        var apply = functions().get(3);
        var applyCalls = apply.callSites();
        assertEquals(applyCalls.size(), 2);
        assertTrue(applyCalls.get(0).isIndirect());
        assertTrue(applyCalls.get(0).getCalleeName().isEmpty());
        assertFalse(applyCalls.get(1).isIndirect());
    }

    @Test
    public void testFunctionNode() {
        var logMsg = functions().get(1);
        var node = new FunctionNode(logMsg, 0);
        assertTrue(node.isVarArg);
        assertEquals(node.fixedParamNum, 1);
        assertEquals(node.callSites.size(), 1);
        assertFalse(node.acceptsArity(0));
        assertTrue(node.acceptsArity(1));
        assertTrue(node.acceptsArity(5));

        var apply = new FunctionNode(functions().get(3), 1);
        // the call through (*fn) is not kept
        assertEquals(apply.callSites.size(), 1);
        assertTrue(apply.acceptsArity(2));
        assertFalse(apply.acceptsArity(3));
    }

    @Test
    public void testEquality() {
        var root = SourceParser.parse(SRC);
        var first = FunctionDefinition.collect(root);
        var second = FunctionDefinition.collect(root);
        assertEquals(first.get(0), second.get(0));
        assertNotEquals(first.get(0), first.get(1));

        // same text, different parse
        var other = functions().get(0);
        assertNotEquals(first.get(0), other);
    }
}
