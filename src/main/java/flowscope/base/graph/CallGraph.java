package flowscope.base.graph;

import flowscope.base.node.CallSite;
import flowscope.base.node.FunctionDefinition;
import flowscope.base.node.FunctionNode;
import flowscope.base.node.NodeBase;
import flowscope.parser.SyntaxNode;
import flowscope.utils.Logging;

import java.util.*;

/**
 * Call graph over a set of function definitions.
 * A call site is matched by callee name and argument count only: a variadic
 * function accepts at least its fixed parameters, any other function exactly
 * its parameters. Calls through anything but a bare identifier are never
 * resolved, and every matching definition of a name gets an edge.
 */
public class CallGraph extends GraphBase<FunctionDefinition> {
    /** The cache of function nodes, in insertion order */
    public final Set<FunctionNode> functionNodes = new LinkedHashSet<>();

    /** Functions that no function in the set calls */
    public final Set<FunctionDefinition> roots = new LinkedHashSet<>();

    public final Set<FunctionNode> leafNodes = new LinkedHashSet<>();

    /** Name to every definition carrying it */
    private final Map<String, List<FunctionNode>> nameToNodes = new LinkedHashMap<>();

    public static CallGraph build(Collection<FunctionDefinition> functions) {
        return new CallGraph(functions);
    }

    /** Call graph over every function definition under {@code root} */
    public static CallGraph of(SyntaxNode root) {
        return new CallGraph(FunctionDefinition.collect(root));
    }

    private CallGraph(Collection<FunctionDefinition> functions) {
        for (var func : functions) {
            if (hasNode(func)) {
                continue;
            }
            var node = (FunctionNode) getNode(func);
            nameToNodes.computeIfAbsent(func.getName(), k -> new ArrayList<>()).add(node);
        }

        int edges = 0;
        for (var caller : functionNodes) {
            for (var callSite : caller.callSites) {
                for (var callee : resolve(callSite)) {
                    if (!hasEdge(caller.value, callee.value)) {
                        addEdge(caller.value, callee.value);
                        edges++;
                    }
                }
            }
        }

        // Update FunctionNode's property
        for (var funcNode : functionNodes) {
            if (funcNode.succ.isEmpty()) {
                funcNode.isLeaf = true;
                leafNodes.add(funcNode);
            }
            if (funcNode.pred.isEmpty()) {
                roots.add(funcNode.value);
            }
        }

        Logging.debug("CallGraph", String.format("Built call graph: %d functions, %d edges, %d roots, %d leaves",
                functionNodes.size(), edges, roots.size(), leafNodes.size()));
    }

    /** Definitions a direct call site may target */
    public List<FunctionNode> resolve(CallSite callSite) {
        List<FunctionNode> result = new ArrayList<>();
        var name = callSite.getCalleeName();
        if (name.isEmpty()) {
            return result;
        }
        for (var candidate : nameToNodes.getOrDefault(name.get(), List.of())) {
            if (candidate.acceptsArity(callSite.getArgumentCount())) {
                result.add(candidate);
            }
        }
        return result;
    }

    @Override
    protected NodeBase<FunctionDefinition> createNode(FunctionDefinition value, int node_id) {
        FunctionNode funcNode = new FunctionNode(value, node_id);
        functionNodes.add(funcNode);
        return funcNode;
    }

    /** @return the node of a function in the set, or null */
    public FunctionNode getFunctionNode(FunctionDefinition value) {
        return (FunctionNode) findNode(value);
    }

    /** Definitions with the given name, overloads included */
    public List<FunctionDefinition> getFunctionsByName(String name) {
        List<FunctionDefinition> res = new ArrayList<>();
        for (var node : nameToNodes.getOrDefault(name, List.of())) {
            res.add(node.value);
        }
        return res;
    }

    public Set<FunctionNode> getCallees(FunctionNode caller) {
        Set<FunctionNode> res = new LinkedHashSet<>();
        for (var callee : caller.succ) {
            res.add((FunctionNode) callee);
        }
        return res;
    }

    public Set<FunctionNode> getCallers(FunctionNode callee) {
        Set<FunctionNode> res = new LinkedHashSet<>();
        for (var caller : callee.pred) {
            res.add((FunctionNode) caller);
        }
        return res;
    }

    /** Callees of the function */
    public Set<FunctionDefinition> neighbors(FunctionDefinition func) {
        return getSuccs(func);
    }

    public String toGraphviz() {
        StringBuilder builder = new StringBuilder();
        builder.append("digraph CallGraph {\n");
        for (var node : functionNodes) {
            builder.append("  f").append(node.id).append(" [label=\"").append(node.getName());
            if (node.isVarArg) {
                builder.append("(...)");
            }
            builder.append("\"];\n");
        }
        for (var node : functionNodes) {
            for (var succ : node.succ) {
                builder.append("  f").append(node.id).append(" -> f").append(succ.id).append(";\n");
            }
        }
        builder.append("}");
        return builder.toString();
    }
}
