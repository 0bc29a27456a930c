package flowscope.base.constraint;

import flowscope.parser.SyntaxNode;

public class MalformedConditionException extends IllegalArgumentException {
    public MalformedConditionException(SyntaxNode condition, String reason) {
        super(String.format("Malformed condition %s: %s", condition.text(), reason));
    }
}
