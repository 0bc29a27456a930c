package flowscope.parser;

import java.util.HashMap;
import java.util.Map;

/**
 * Kinds of syntax nodes produced by the C front end. The names follow the
 * tree-sitter C grammar so that tools written against tree-sitter dumps read
 * the same way.
 */
public enum NodeKind {
    TRANSLATION_UNIT("translation_unit"),

    // Declarations
    FUNCTION_DEFINITION("function_definition"),
    DECLARATION("declaration"),
    INIT_DECLARATOR("init_declarator"),
    POINTER_DECLARATOR("pointer_declarator"),
    ARRAY_DECLARATOR("array_declarator"),
    FUNCTION_DECLARATOR("function_declarator"),
    PARENTHESIZED_DECLARATOR("parenthesized_declarator"),
    ABSTRACT_DECLARATOR("abstract_declarator"),
    PARAMETER_LIST("parameter_list"),
    PARAMETER_DECLARATION("parameter_declaration"),
    VARIADIC_PARAMETER("variadic_parameter"),
    INITIALIZER_LIST("initializer_list"),
    INITIALIZER_PAIR("initializer_pair"),
    SUBSCRIPT_DESIGNATOR("subscript_designator"),
    FIELD_DESIGNATOR("field_designator"),

    // Types
    PRIMITIVE_TYPE("primitive_type"),
    TYPE_IDENTIFIER("type_identifier"),
    TYPE_DESCRIPTOR("type_descriptor"),
    STRUCT_SPECIFIER("struct_specifier"),
    UNION_SPECIFIER("union_specifier"),
    ENUM_SPECIFIER("enum_specifier"),
    FIELD_DECLARATION_LIST("field_declaration_list"),
    FIELD_DECLARATION("field_declaration"),
    ENUMERATOR_LIST("enumerator_list"),
    ENUMERATOR("enumerator"),
    STORAGE_CLASS_SPECIFIER("storage_class_specifier"),
    TYPE_QUALIFIER("type_qualifier"),
    FUNCTION_SPECIFIER("function_specifier"),

    // Statements
    COMPOUND_STATEMENT("compound_statement"),
    EXPRESSION_STATEMENT("expression_statement"),
    LABELED_STATEMENT("labeled_statement"),
    IF_STATEMENT("if_statement"),
    SWITCH_STATEMENT("switch_statement"),
    CASE_STATEMENT("case_statement"),
    WHILE_STATEMENT("while_statement"),
    DO_STATEMENT("do_statement"),
    FOR_STATEMENT("for_statement"),
    GOTO_STATEMENT("goto_statement"),
    CONTINUE_STATEMENT("continue_statement"),
    BREAK_STATEMENT("break_statement"),
    RETURN_STATEMENT("return_statement"),
    STATEMENT_IDENTIFIER("statement_identifier"),

    // Expressions
    IDENTIFIER("identifier"),
    FIELD_IDENTIFIER("field_identifier"),
    NUMBER_LITERAL("number_literal"),
    CHAR_LITERAL("char_literal"),
    STRING_LITERAL("string_literal"),
    CONCATENATED_STRING("concatenated_string"),
    PARENTHESIZED_EXPRESSION("parenthesized_expression"),
    COMMA_EXPRESSION("comma_expression"),
    SUBSCRIPT_EXPRESSION("subscript_expression"),
    CALL_EXPRESSION("call_expression"),
    ARGUMENT_LIST("argument_list"),
    FIELD_EXPRESSION("field_expression"),
    UPDATE_EXPRESSION("update_expression"),
    SIZEOF_EXPRESSION("sizeof_expression"),
    CAST_EXPRESSION("cast_expression"),
    POINTER_EXPRESSION("pointer_expression"),
    UNARY_EXPRESSION("unary_expression"),
    BINARY_EXPRESSION("binary_expression"),
    CONDITIONAL_EXPRESSION("conditional_expression"),
    ASSIGNMENT_EXPRESSION("assignment_expression");

    private static final Map<String, NodeKind> BY_TYPE_NAME = new HashMap<>();

    static {
        for (var kind : values()) {
            BY_TYPE_NAME.put(kind.typeName, kind);
        }
    }

    private final String typeName;

    NodeKind(String typeName) {
        this.typeName = typeName;
    }

    /** The tree-sitter type name, e.g. {@code if_statement} */
    public String typeName() {
        return typeName;
    }

    public static NodeKind fromTypeName(String typeName) {
        NodeKind kind = BY_TYPE_NAME.get(typeName);
        if (kind == null) {
            throw new IllegalArgumentException("Unknown node type: " + typeName);
        }
        return kind;
    }

    @Override
    public String toString() {
        return typeName;
    }
}
