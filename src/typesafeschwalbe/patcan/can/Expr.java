package typesafeschwalbe.patcan.can;

import java.util.List;
import java.util.Map;
import java.util.Objects;

import typesafeschwalbe.patcan.compiler.Source;
import typesafeschwalbe.patcan.compiler.Symbol;
import typesafeschwalbe.patcan.types.Variable;

public class Expr {

    public static record Var(
        Symbol symbol
    ) {}

    public static record NumLiteral(
        Variable variable,
        String text,
        NumLiterals.IntValue value,
        NumLiterals.NumericBound bound
    ) {}

    public static record IntLiteral(
        Variable variable,
        Variable precisionVar,
        String text,
        NumLiterals.IntValue value,
        NumLiterals.IntBound bound
    ) {}

    public static record FloatLiteral(
        Variable variable,
        Variable precisionVar,
        String text,
        double value,
        NumLiterals.FloatBound bound
    ) {}

    public static record Str(
        String text
    ) {}

    public static record StrInterpolation(
        List<Expr> segments
    ) {}

    public static record Argument(Variable variable, Expr expr) {}

    public static record Tag(
        Variable variantVar,
        Variable extVar,
        String name,
        List<Argument> arguments
    ) {}

    public static record Field(Variable variable, Expr expr) {}

    public static record RecordLiteral(
        Variable recordVar,
        Map<String, Field> fields
    ) {}

    public static record RuntimeError(
        Problem problem
    ) {}

    public enum Type {
        VAR,               // Var
        NUM_LITERAL,       // NumLiteral
        INT_LITERAL,       // IntLiteral
        FLOAT_LITERAL,     // FloatLiteral
        STR,               // Str
        STR_INTERPOLATION, // StrInterpolation
        TAG,               // Tag
        RECORD,            // RecordLiteral
        RUNTIME_ERROR      // RuntimeError
    }

    public final Type type;
    private final Object value;
    public final Source source;

    public Expr(Type type, Object value, Source source) {
        this.type = type;
        this.value = value;
        this.source = source;
    }

    @SuppressWarnings("unchecked")
    public <T> T getValue() {
        return (T) this.value;
    }

    @Override
    public boolean equals(Object otherRaw) {
        if(!(otherRaw instanceof Expr)) { return false; }
        Expr other = (Expr) otherRaw;
        return this.type == other.type
            && Objects.equals(this.value, other.value)
            && this.source.equals(other.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.type, this.value, this.source);
    }

    @Override
    public String toString() {
        return this.type + "(" + this.value + ")";
    }

}
