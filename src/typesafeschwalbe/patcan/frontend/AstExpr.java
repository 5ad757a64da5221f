package typesafeschwalbe.patcan.frontend;

import java.util.List;
import java.util.Map;

import typesafeschwalbe.patcan.compiler.Source;

public class AstExpr {

    public static record VariableAccess(
        String variableName
    ) {}

    public static record SimpleLiteral(
        String value
    ) {}

    public static record Tag(
        String tagName,
        List<AstExpr> arguments
    ) {}

    public static record RecordLiteral(
        Map<String, AstExpr> fields
    ) {}

    public enum Type {
        VARIABLE_ACCESS, // VariableAccess
        NUM_LITERAL,     // SimpleLiteral
        FLOAT_LITERAL,   // SimpleLiteral
        STR_LITERAL,     // StrLiteral
        TAG,             // Tag
        RECORD           // RecordLiteral
    }

    public final Type type;
    private final Object value;
    public final Source source;

    public AstExpr(Type type, Object value, Source source) {
        this.type = type;
        this.value = value;
        this.source = source;
    }

    @SuppressWarnings("unchecked")
    public <T> T getValue() {
        return (T) this.value;
    }

    @Override
    public String toString() {
        return this.type + "(" + this.value + ")";
    }

}
