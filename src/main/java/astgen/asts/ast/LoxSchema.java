package astgen.asts.ast;

import com.google.common.collect.ImmutableList;

import static astgen.asts.ast.AbstractType.*;
import static astgen.asts.ast.NodeDefinition.field;
import static astgen.asts.ast.NodeDefinition.node;

/**
 * Syntax tree of the Lox language.
 */
public final class LoxSchema {

    public static final String TEXT = "Text";
    public static final String VALUE = "Value";

    public static final Family EXPRESSION = new Family("Expression", ImmutableList.of(TEXT, VALUE), ImmutableList.of(
            node("Assign",
                    field("name", token()),
                    field("value", self())),
            node("Binary",
                    field("left", self()),
                    field("operator", token()),
                    field("right", self())),
            node("Call",
                    field("callee", self()),
                    field("paren", token()),
                    field("arguments", sequence(self()))),
            node("Get",
                    field("object", self()),
                    field("name", token())),
            node("Grouping",
                    field("expression", self())),
            node("Literal",
                    field("value", object())),
            node("Logical",
                    field("left", self()),
                    field("operator", token()),
                    field("right", self())),
            node("Set",
                    field("object", self()),
                    field("name", token()),
                    field("value", self())),
            node("Super",
                    field("keyword", token()),
                    field("method", token())),
            node("This",
                    field("keyword", token())),
            node("Ternary",
                    field("condition", self()),
                    field("true", self()),
                    field("false", self())),
            node("Unary",
                    field("operator", token()),
                    field("right", self())),
            node("Variable",
                    field("name", token()))
    ));

    public static final Family STATEMENT = new Family("Statement", ImmutableList.of(VALUE), ImmutableList.of(
            node("Block",
                    field("statements", sequence(self()))),
            node("Break",
                    field("keyword", token())),
            node("Class",
                    field("name", token()),
                    field("superclass", specificVariant("Variable")),
                    field("methods", sequence(specificVariant("Function")))),
            node("Continue",
                    field("keyword", token())),
            node("Expression",
                    field("expression", otherFamily("Expression"))),
            node("Function",
                    field("name", token()),
                    field("params", sequence(token())),
                    field("body", sequence(self()))),
            node("If",
                    field("condition", otherFamily("Expression")),
                    field("then", self()),
                    field("else", self())),
            node("Print",
                    field("expression", otherFamily("Expression"))),
            node("Return",
                    field("keyword", token()),
                    field("value", otherFamily("Expression"))),
            node("Var",
                    field("name", token()),
                    field("initializer", otherFamily("Expression"))),
            node("While", "For statement desugars to a While statement",
                    field("condition", otherFamily("Expression")),
                    field("body", self()))
    ));

    public static final Schema SCHEMA = Schema.of(EXPRESSION, STATEMENT);

    private LoxSchema() {
    }
}
