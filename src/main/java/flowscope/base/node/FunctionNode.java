package flowscope.base.node;

import flowscope.utils.Logging;

import java.util.ArrayList;
import java.util.List;

public class FunctionNode extends NodeBase<FunctionDefinition> {

    /** Whether the function is a leaf node in the call graph */
    public boolean isLeaf = false;

    public boolean isVarArg = false;
    public int fixedParamNum = 0;

    /** Direct call sites only, in source order */
    public final List<CallSite> callSites = new ArrayList<>();

    public FunctionNode(FunctionDefinition value, int id) {
        super(value, id);
        this.isVarArg = value.isVariadic();
        this.fixedParamNum = value.fixedParamNum();
        for (var callSite : value.callSites()) {
            if (callSite.isIndirect()) {
                Logging.trace("FunctionNode", "Skip indirect call " + callSite);
                continue;
            }
            callSites.add(callSite);
        }
    }

    public String getName() {
        return value.getName();
    }

    /**
     * Whether a call passing {@code argumentCount} arguments can target this function.
     * Variadic functions accept any count not below the fixed parameters.
     */
    public boolean acceptsArity(int argumentCount) {
        return isVarArg ? argumentCount >= fixedParamNum : argumentCount == fixedParamNum;
    }
}
