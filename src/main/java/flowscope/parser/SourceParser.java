package flowscope.parser;

import flowscope.utils.Logging;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Entry point of the front end: C source text in, {@link SyntaxNode} tree out.
 */
public class SourceParser {

    private SourceParser() {
    }

    /**
     * Parse a whole source buffer.
     * @param source the C source text
     * @return the {@code translation_unit} root
     * @throws SourceParseException on the first syntax error
     */
    public static SyntaxNode parse(String source) {
        CLexer lexer = new CLexer(CharStreams.fromString(source));
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);

        CParser parser = new CParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(ThrowingErrorListener.INSTANCE);

        CParser.TranslationUnitContext unit = parser.translationUnit();
        TreeNode root = new SyntaxTreeBuilder(source).visit(unit);
        Logging.trace("Parser", "Parsed " + root.children().size() + " top-level items");
        return root;
    }

    public static SyntaxNode parse(Path file) throws IOException {
        Logging.debug("Parser", "Parsing " + file);
        return parse(Files.readString(file, StandardCharsets.UTF_8));
    }
}
