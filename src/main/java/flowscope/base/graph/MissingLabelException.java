package flowscope.base.graph;

/**
 * A {@code goto} whose label is not defined in the analysed statements.
 */
public class MissingLabelException extends IllegalStateException {
    public final String label;

    public MissingLabelException(String label, String gotoText) {
        super(String.format("Label '%s' used by '%s' is not defined", label, gotoText));
        this.label = label;
    }
}
