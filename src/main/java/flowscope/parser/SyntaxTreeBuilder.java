package flowscope.parser;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.Arrays;
import java.util.List;

/**
 * Converts the ANTLR parse tree of {@code C.g4} into {@link TreeNode}s.
 * Every visit method returns the node for its rule, or {@code null} when
 * the rule has nothing to contribute.
 */
public class SyntaxTreeBuilder extends CBaseVisitor<TreeNode> {
    private final String source;
    private final int[] lineStarts;
    /** UTF-16 offset of every code point, null when the source has no surrogate pairs */
    private final int[] charOffsets;

    public SyntaxTreeBuilder(String source) {
        this.source = source;
        this.lineStarts = computeLineStarts(source);
        this.charOffsets = computeCharOffsets(source);
    }

    private static int[] computeCharOffsets(String source) {
        int codePoints = source.codePointCount(0, source.length());
        if (codePoints == source.length()) {
            return null;
        }
        int[] offsets = new int[codePoints + 1];
        int offset = 0;
        for (int i = 0; i < codePoints; i++) {
            offsets[i] = offset;
            offset += Character.charCount(source.codePointAt(offset));
        }
        offsets[codePoints] = source.length();
        return offsets;
    }

    /** ANTLR token indices count code points, {@link Span} counts UTF-16 chars */
    private int toCharOffset(int codePointIndex) {
        return charOffsets == null ? codePointIndex : charOffsets[codePointIndex];
    }

    private static int[] computeLineStarts(String source) {
        int[] starts = new int[source.length() + 1];
        int count = 0;
        starts[count++] = 0;
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                starts[count++] = i + 1;
            }
        }
        return Arrays.copyOf(starts, count);
    }

    /* ---------------------------------------------------------------- spans */

    private Span span(int startOffset, int endOffset) {
        int startLine = lineOf(startOffset);
        int endLine = lineOf(endOffset);
        return new Span(startOffset, endOffset,
                startLine + 1, startOffset - lineStarts[startLine],
                endLine + 1, endOffset - lineStarts[endLine]);
    }

    private int lineOf(int offset) {
        int index = Arrays.binarySearch(lineStarts, offset);
        return index >= 0 ? index : -index - 2;
    }

    private Span span(Token start, Token stop) {
        return span(toCharOffset(start.getStartIndex()), toCharOffset(stop.getStopIndex() + 1));
    }

    private Span span(ParserRuleContext ctx) {
        return span(ctx.getStart(), ctx.getStop());
    }

    private TreeNode node(NodeKind kind, ParserRuleContext ctx) {
        return new TreeNode(kind, span(ctx), source);
    }

    private TreeNode node(NodeKind kind, Token start, Token stop) {
        return new TreeNode(kind, span(start, stop), source);
    }

    private TreeNode leaf(NodeKind kind, Token token) {
        return new TreeNode(kind, span(token, token), source);
    }

    private TreeNode leaf(NodeKind kind, TerminalNode terminal) {
        return terminal == null ? null : leaf(kind, terminal.getSymbol());
    }

    private TreeNode visitOrNull(ParseTree tree) {
        return tree == null ? null : visit(tree);
    }

    /* ------------------------------------------------------- translation unit */

    @Override
    public TreeNode visitTranslationUnit(CParser.TranslationUnitContext ctx) {
        TreeNode unit = new TreeNode(NodeKind.TRANSLATION_UNIT, span(0, source.length()), source);
        for (var item : ctx.topLevelItem()) {
            unit.addChild(visit(item));
        }
        return unit;
    }

    @Override
    public TreeNode visitTopLevelItem(CParser.TopLevelItemContext ctx) {
        return visit(ctx.getChild(0));
    }

    @Override
    public TreeNode visitFunctionDefinition(CParser.FunctionDefinitionContext ctx) {
        TreeNode function = node(NodeKind.FUNCTION_DEFINITION, ctx);
        addSpecifiers(function, ctx.declarationSpecifiers().children);
        function.addField("declarator", visit(ctx.declarator()));
        function.addField("body", visit(ctx.compoundStatement()));
        return function;
    }

    /* ---------------------------------------------------------- declarations */

    @Override
    public TreeNode visitDeclaration(CParser.DeclarationContext ctx) {
        TreeNode declaration = node(NodeKind.DECLARATION, ctx);
        addSpecifiers(declaration, ctx.declarationSpecifiers().children);
        if (ctx.initDeclaratorList() != null) {
            boolean first = true;
            for (var initDeclarator : ctx.initDeclaratorList().initDeclarator()) {
                TreeNode declarator = visit(initDeclarator);
                declaration.addChild(declarator);
                if (first) {
                    declaration.markField("declarator", declarator);
                    first = false;
                }
            }
        }
        return declaration;
    }

    /**
     * Add storage classes, qualifiers and type specifiers in source order.
     * The first type specifier becomes the {@code type} field.
     */
    private void addSpecifiers(TreeNode owner, List<ParseTree> specifiers) {
        TreeNode type = null;
        for (var specifier : specifiers) {
            TreeNode child;
            boolean isType = false;
            if (specifier instanceof CParser.DeclarationModifierContext modifier) {
                child = visit(modifier);
            } else if (specifier instanceof CParser.TypeQualifierContext qualifier) {
                child = visit(qualifier);
            } else if (specifier instanceof CParser.TypeSpecifierContext typeSpecifier) {
                child = visit(typeSpecifier);
                isType = true;
            } else if (specifier instanceof CParser.BuiltinTypeContext builtin) {
                child = visit(builtin);
                isType = true;
            } else {
                continue;
            }
            owner.addChild(child);
            if (isType && type == null) {
                type = child;
                owner.markField("type", child);
            }
        }
    }

    @Override
    public TreeNode visitDeclarationModifier(CParser.DeclarationModifierContext ctx) {
        return visit(ctx.getChild(0));
    }

    @Override
    public TreeNode visitStorageClassSpecifier(CParser.StorageClassSpecifierContext ctx) {
        return node(NodeKind.STORAGE_CLASS_SPECIFIER, ctx);
    }

    @Override
    public TreeNode visitTypeQualifier(CParser.TypeQualifierContext ctx) {
        return node(NodeKind.TYPE_QUALIFIER, ctx);
    }

    @Override
    public TreeNode visitFunctionSpecifier(CParser.FunctionSpecifierContext ctx) {
        return node(NodeKind.FUNCTION_SPECIFIER, ctx);
    }

    @Override
    public TreeNode visitTypeSpecifier(CParser.TypeSpecifierContext ctx) {
        return visit(ctx.getChild(0));
    }

    @Override
    public TreeNode visitBuiltinType(CParser.BuiltinTypeContext ctx) {
        return node(NodeKind.PRIMITIVE_TYPE, ctx);
    }

    @Override
    public TreeNode visitTypedefName(CParser.TypedefNameContext ctx) {
        return node(NodeKind.TYPE_IDENTIFIER, ctx);
    }

    @Override
    public TreeNode visitStructOrUnionSpecifier(CParser.StructOrUnionSpecifierContext ctx) {
        NodeKind kind = ctx.kw.getText().equals("union") ? NodeKind.UNION_SPECIFIER : NodeKind.STRUCT_SPECIFIER;
        TreeNode specifier = node(kind, ctx);
        specifier.addField("name", leaf(NodeKind.TYPE_IDENTIFIER, ctx.Identifier()));
        if (ctx.lb != null) {
            TreeNode body = node(NodeKind.FIELD_DECLARATION_LIST, ctx.lb, ctx.rb);
            for (var field : ctx.structDeclaration()) {
                body.addChild(visit(field));
            }
            specifier.addField("body", body);
        }
        return specifier;
    }

    @Override
    public TreeNode visitStructDeclaration(CParser.StructDeclarationContext ctx) {
        TreeNode field = node(NodeKind.FIELD_DECLARATION, ctx);
        addSpecifiers(field, ctx.specifierQualifierList().children);
        boolean first = true;
        for (var structDeclarator : ctx.structDeclarator()) {
            if (structDeclarator.declarator() == null) {
                continue;
            }
            TreeNode declarator = visit(structDeclarator.declarator());
            field.addChild(declarator);
            if (first) {
                field.markField("declarator", declarator);
                first = false;
            }
        }
        return field;
    }

    @Override
    public TreeNode visitEnumSpecifier(CParser.EnumSpecifierContext ctx) {
        TreeNode specifier = node(NodeKind.ENUM_SPECIFIER, ctx);
        specifier.addField("name", leaf(NodeKind.TYPE_IDENTIFIER, ctx.Identifier()));
        if (ctx.lb != null) {
            TreeNode body = node(NodeKind.ENUMERATOR_LIST, ctx.lb, ctx.rb);
            for (var enumerator : ctx.enumerator()) {
                body.addChild(visit(enumerator));
            }
            specifier.addField("body", body);
        }
        return specifier;
    }

    @Override
    public TreeNode visitEnumerator(CParser.EnumeratorContext ctx) {
        TreeNode enumerator = node(NodeKind.ENUMERATOR, ctx);
        enumerator.addField("name", leaf(NodeKind.IDENTIFIER, ctx.Identifier()));
        enumerator.addField("value", visitOrNull(ctx.expr()));
        return enumerator;
    }

    @Override
    public TreeNode visitInitDeclarator(CParser.InitDeclaratorContext ctx) {
        TreeNode declarator = visit(ctx.declarator());
        if (ctx.initializer() == null) {
            return declarator;
        }
        TreeNode initDeclarator = node(NodeKind.INIT_DECLARATOR, ctx);
        initDeclarator.addField("declarator", declarator);
        initDeclarator.addField("value", visit(ctx.initializer()));
        return initDeclarator;
    }

    @Override
    public TreeNode visitInitializer(CParser.InitializerContext ctx) {
        if (ctx.expr() != null) {
            return visit(ctx.expr());
        }
        TreeNode list = node(NodeKind.INITIALIZER_LIST, ctx);
        for (var item : ctx.initializerItem()) {
            list.addChild(visit(item));
        }
        return list;
    }

    @Override
    public TreeNode visitInitializerItem(CParser.InitializerItemContext ctx) {
        TreeNode value = visit(ctx.initializer());
        if (ctx.designator().isEmpty()) {
            return value;
        }
        TreeNode pair = node(NodeKind.INITIALIZER_PAIR, ctx);
        for (var designator : ctx.designator()) {
            TreeNode child = visit(designator);
            pair.addChild(child);
            if (pair.childByField("designator").isEmpty()) {
                pair.markField("designator", child);
            }
        }
        pair.addField("value", value);
        return pair;
    }

    @Override
    public TreeNode visitDesignator(CParser.DesignatorContext ctx) {
        if (ctx.expr() != null) {
            return node(NodeKind.SUBSCRIPT_DESIGNATOR, ctx).addChild(visit(ctx.expr()));
        }
        return node(NodeKind.FIELD_DESIGNATOR, ctx).addChild(leaf(NodeKind.FIELD_IDENTIFIER, ctx.Identifier()));
    }

    /**
     * One {@code pointer_declarator} per star, outermost first, each ending
     * where the whole declarator ends.
     */
    @Override
    public TreeNode visitDeclarator(CParser.DeclaratorContext ctx) {
        TreeNode inner = visit(ctx.directDeclarator());
        if (ctx.pointer() == null) {
            return inner;
        }
        List<Token> stars = ctx.pointer().stars;
        for (int i = stars.size() - 1; i >= 0; i--) {
            TreeNode pointer = node(NodeKind.POINTER_DECLARATOR, stars.get(i), ctx.getStop());
            pointer.addField("declarator", inner);
            inner = pointer;
        }
        return inner;
    }

    @Override
    public TreeNode visitIdentifierDeclarator(CParser.IdentifierDeclaratorContext ctx) {
        return leaf(NodeKind.IDENTIFIER, ctx.Identifier());
    }

    @Override
    public TreeNode visitParenthesizedDeclarator(CParser.ParenthesizedDeclaratorContext ctx) {
        return node(NodeKind.PARENTHESIZED_DECLARATOR, ctx).addField("declarator", visit(ctx.declarator()));
    }

    @Override
    public TreeNode visitArrayDeclarator(CParser.ArrayDeclaratorContext ctx) {
        TreeNode array = node(NodeKind.ARRAY_DECLARATOR, ctx);
        array.addField("declarator", visit(ctx.directDeclarator()));
        array.addField("size", visitOrNull(ctx.expr()));
        return array;
    }

    @Override
    public TreeNode visitFunctionDeclarator(CParser.FunctionDeclaratorContext ctx) {
        TreeNode function = node(NodeKind.FUNCTION_DECLARATOR, ctx);
        function.addField("declarator", visit(ctx.directDeclarator()));
        function.addField("parameters", parameterList(ctx.parameterList(), ctx.lp, ctx.rp));
        return function;
    }

    private TreeNode parameterList(CParser.ParameterListContext ctx, Token lp, Token rp) {
        TreeNode list = node(NodeKind.PARAMETER_LIST, lp, rp);
        if (ctx == null) {
            return list;
        }
        for (var parameter : ctx.parameterDeclaration()) {
            list.addChild(visit(parameter));
        }
        if (ctx.variadic != null) {
            list.addChild(leaf(NodeKind.VARIADIC_PARAMETER, ctx.variadic));
        }
        return list;
    }

    @Override
    public TreeNode visitParameterDeclaration(CParser.ParameterDeclarationContext ctx) {
        TreeNode parameter = node(NodeKind.PARAMETER_DECLARATION, ctx);
        addSpecifiers(parameter, ctx.declarationSpecifiers().children);
        if (ctx.declarator() != null) {
            parameter.addField("declarator", visit(ctx.declarator()));
        } else if (ctx.abstractDeclarator() != null) {
            parameter.addField("declarator", visit(ctx.abstractDeclarator()));
        }
        return parameter;
    }

    @Override
    public TreeNode visitAbstractDeclarator(CParser.AbstractDeclaratorContext ctx) {
        return node(NodeKind.ABSTRACT_DECLARATOR, ctx);
    }

    @Override
    public TreeNode visitTypeName(CParser.TypeNameContext ctx) {
        TreeNode descriptor = node(NodeKind.TYPE_DESCRIPTOR, ctx);
        addSpecifiers(descriptor, ctx.specifierQualifierList().children);
        descriptor.addField("declarator", visitOrNull(ctx.abstractDeclarator()));
        return descriptor;
    }

    /* ------------------------------------------------------------ statements */

    @Override
    public TreeNode visitStatement(CParser.StatementContext ctx) {
        return visit(ctx.getChild(0));
    }

    @Override
    public TreeNode visitBlockItem(CParser.BlockItemContext ctx) {
        return visit(ctx.getChild(0));
    }

    @Override
    public TreeNode visitCaseBodyItem(CParser.CaseBodyItemContext ctx) {
        return visit(ctx.getChild(0));
    }

    @Override
    public TreeNode visitLabeledStatement(CParser.LabeledStatementContext ctx) {
        TreeNode labeled = node(NodeKind.LABELED_STATEMENT, ctx);
        labeled.addField("label", leaf(NodeKind.STATEMENT_IDENTIFIER, ctx.Identifier()));
        labeled.addChild(visit(ctx.statement()));
        return labeled;
    }

    @Override
    public TreeNode visitCompoundStatement(CParser.CompoundStatementContext ctx) {
        TreeNode compound = node(NodeKind.COMPOUND_STATEMENT, ctx);
        for (var item : ctx.blockItem()) {
            compound.addChild(visit(item));
        }
        return compound;
    }

    @Override
    public TreeNode visitCaseStatement(CParser.CaseStatementContext ctx) {
        TreeNode caseStatement = node(NodeKind.CASE_STATEMENT, ctx);
        caseStatement.addField("value", visitOrNull(ctx.expr()));
        for (var item : ctx.caseBodyItem()) {
            caseStatement.addChild(visit(item));
        }
        return caseStatement;
    }

    @Override
    public TreeNode visitExpressionStatement(CParser.ExpressionStatementContext ctx) {
        return node(NodeKind.EXPRESSION_STATEMENT, ctx).addChild(visitOrNull(ctx.expression()));
    }

    @Override
    public TreeNode visitIfStatement(CParser.IfStatementContext ctx) {
        TreeNode ifStatement = node(NodeKind.IF_STATEMENT, ctx);
        ifStatement.addField("condition", visit(ctx.parenthesizedExpression()));
        ifStatement.addField("consequence", visit(ctx.statement(0)));
        if (ctx.statement().size() > 1) {
            ifStatement.addField("alternative", visit(ctx.statement(1)));
        }
        return ifStatement;
    }

    @Override
    public TreeNode visitSwitchStatement(CParser.SwitchStatementContext ctx) {
        TreeNode switchStatement = node(NodeKind.SWITCH_STATEMENT, ctx);
        switchStatement.addField("condition", visit(ctx.parenthesizedExpression()));
        switchStatement.addField("body", visit(ctx.statement()));
        return switchStatement;
    }

    @Override
    public TreeNode visitWhileStatement(CParser.WhileStatementContext ctx) {
        TreeNode whileStatement = node(NodeKind.WHILE_STATEMENT, ctx);
        whileStatement.addField("condition", visit(ctx.parenthesizedExpression()));
        whileStatement.addField("body", visit(ctx.statement()));
        return whileStatement;
    }

    @Override
    public TreeNode visitDoStatement(CParser.DoStatementContext ctx) {
        TreeNode doStatement = node(NodeKind.DO_STATEMENT, ctx);
        doStatement.addField("body", visit(ctx.statement()));
        doStatement.addField("condition", visit(ctx.parenthesizedExpression()));
        return doStatement;
    }

    @Override
    public TreeNode visitForStatement(CParser.ForStatementContext ctx) {
        TreeNode forStatement = node(NodeKind.FOR_STATEMENT, ctx);
        if (ctx.declaration() != null) {
            forStatement.addField("initializer", visit(ctx.declaration()));
        } else {
            forStatement.addField("initializer", visitOrNull(ctx.init));
        }
        forStatement.addField("condition", visitOrNull(ctx.cond));
        forStatement.addField("update", visitOrNull(ctx.update));
        forStatement.addField("body", visit(ctx.statement()));
        return forStatement;
    }

    @Override
    public TreeNode visitGotoStatement(CParser.GotoStatementContext ctx) {
        return node(NodeKind.GOTO_STATEMENT, ctx)
                .addField("label", leaf(NodeKind.STATEMENT_IDENTIFIER, ctx.Identifier()));
    }

    @Override
    public TreeNode visitContinueStatement(CParser.ContinueStatementContext ctx) {
        return node(NodeKind.CONTINUE_STATEMENT, ctx);
    }

    @Override
    public TreeNode visitBreakStatement(CParser.BreakStatementContext ctx) {
        return node(NodeKind.BREAK_STATEMENT, ctx);
    }

    @Override
    public TreeNode visitReturnStatement(CParser.ReturnStatementContext ctx) {
        return node(NodeKind.RETURN_STATEMENT, ctx).addChild(visitOrNull(ctx.expression()));
    }

    /* ----------------------------------------------------------- expressions */

    @Override
    public TreeNode visitParenthesizedExpression(CParser.ParenthesizedExpressionContext ctx) {
        return node(NodeKind.PARENTHESIZED_EXPRESSION, ctx).addChild(visit(ctx.expression()));
    }

    @Override
    public TreeNode visitExpression(CParser.ExpressionContext ctx) {
        if (ctx.expr().size() == 1) {
            return visit(ctx.expr(0));
        }
        TreeNode comma = node(NodeKind.COMMA_EXPRESSION, ctx);
        for (var operand : ctx.expr()) {
            comma.addChild(visit(operand));
        }
        return comma;
    }

    @Override
    public TreeNode visitPrimaryExpr(CParser.PrimaryExprContext ctx) {
        return visit(ctx.primaryExpression());
    }

    @Override
    public TreeNode visitIdentifierExpr(CParser.IdentifierExprContext ctx) {
        return node(NodeKind.IDENTIFIER, ctx);
    }

    @Override
    public TreeNode visitNumberExpr(CParser.NumberExprContext ctx) {
        return node(NodeKind.NUMBER_LITERAL, ctx);
    }

    @Override
    public TreeNode visitCharExpr(CParser.CharExprContext ctx) {
        return node(NodeKind.CHAR_LITERAL, ctx);
    }

    @Override
    public TreeNode visitStringExpr(CParser.StringExprContext ctx) {
        if (ctx.StringLiteral().size() == 1) {
            return node(NodeKind.STRING_LITERAL, ctx);
        }
        TreeNode concatenated = node(NodeKind.CONCATENATED_STRING, ctx);
        for (var literal : ctx.StringLiteral()) {
            concatenated.addChild(leaf(NodeKind.STRING_LITERAL, literal));
        }
        return concatenated;
    }

    @Override
    public TreeNode visitParenExpr(CParser.ParenExprContext ctx) {
        return node(NodeKind.PARENTHESIZED_EXPRESSION, ctx).addChild(visit(ctx.expression()));
    }

    @Override
    public TreeNode visitSubscriptExpr(CParser.SubscriptExprContext ctx) {
        TreeNode subscript = node(NodeKind.SUBSCRIPT_EXPRESSION, ctx);
        subscript.addField("argument", visit(ctx.expr()));
        subscript.addField("index", visit(ctx.expression()));
        return subscript;
    }

    @Override
    public TreeNode visitCallExpr(CParser.CallExprContext ctx) {
        TreeNode call = node(NodeKind.CALL_EXPRESSION, ctx);
        call.addField("function", visit(ctx.expr()));
        TreeNode arguments = node(NodeKind.ARGUMENT_LIST, ctx.lp, ctx.rp);
        if (ctx.argumentList() != null) {
            for (var argument : ctx.argumentList().expr()) {
                arguments.addChild(visit(argument));
            }
        }
        call.addField("arguments", arguments);
        return call;
    }

    @Override
    public TreeNode visitFieldExpr(CParser.FieldExprContext ctx) {
        TreeNode field = node(NodeKind.FIELD_EXPRESSION, ctx);
        field.addField("argument", visit(ctx.expr()));
        field.addField("field", leaf(NodeKind.FIELD_IDENTIFIER, ctx.Identifier()));
        return field.setOperator(ctx.op.getText());
    }

    @Override
    public TreeNode visitPostfixUpdateExpr(CParser.PostfixUpdateExprContext ctx) {
        return node(NodeKind.UPDATE_EXPRESSION, ctx)
                .addField("argument", visit(ctx.expr()))
                .setOperator(ctx.op.getText());
    }

    @Override
    public TreeNode visitPrefixUpdateExpr(CParser.PrefixUpdateExprContext ctx) {
        return node(NodeKind.UPDATE_EXPRESSION, ctx)
                .addField("argument", visit(ctx.expr()))
                .setOperator(ctx.op.getText());
    }

    @Override
    public TreeNode visitSizeofTypeExpr(CParser.SizeofTypeExprContext ctx) {
        return node(NodeKind.SIZEOF_EXPRESSION, ctx).addField("type", visit(ctx.typeName()));
    }

    @Override
    public TreeNode visitSizeofExpr(CParser.SizeofExprContext ctx) {
        return node(NodeKind.SIZEOF_EXPRESSION, ctx).addField("value", visit(ctx.expr()));
    }

    @Override
    public TreeNode visitCastExpr(CParser.CastExprContext ctx) {
        TreeNode cast = node(NodeKind.CAST_EXPRESSION, ctx);
        cast.addField("type", visit(ctx.typeName()));
        cast.addField("value", visit(ctx.expr()));
        return cast;
    }

    @Override
    public TreeNode visitPointerExpr(CParser.PointerExprContext ctx) {
        return node(NodeKind.POINTER_EXPRESSION, ctx)
                .addField("argument", visit(ctx.expr()))
                .setOperator(ctx.op.getText());
    }

    @Override
    public TreeNode visitUnaryExpr(CParser.UnaryExprContext ctx) {
        return node(NodeKind.UNARY_EXPRESSION, ctx)
                .addField("argument", visit(ctx.expr()))
                .setOperator(ctx.op.getText());
    }

    @Override
    public TreeNode visitBinaryExpr(CParser.BinaryExprContext ctx) {
        TreeNode binary = node(NodeKind.BINARY_EXPRESSION, ctx);
        binary.addField("left", visit(ctx.expr(0)));
        binary.addField("right", visit(ctx.expr(1)));
        return binary.setOperator(ctx.op.getText());
    }

    @Override
    public TreeNode visitConditionalExpr(CParser.ConditionalExprContext ctx) {
        TreeNode conditional = node(NodeKind.CONDITIONAL_EXPRESSION, ctx);
        conditional.addField("condition", visit(ctx.expr(0)));
        conditional.addField("consequence", visit(ctx.expression()));
        conditional.addField("alternative", visit(ctx.expr(1)));
        return conditional;
    }

    @Override
    public TreeNode visitAssignmentExpr(CParser.AssignmentExprContext ctx) {
        TreeNode assignment = node(NodeKind.ASSIGNMENT_EXPRESSION, ctx);
        assignment.addField("left", visit(ctx.expr(0)));
        assignment.addField("right", visit(ctx.expr(1)));
        return assignment.setOperator(ctx.op.getText());
    }
}
