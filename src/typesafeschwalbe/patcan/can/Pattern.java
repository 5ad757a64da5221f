package typesafeschwalbe.patcan.can;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import typesafeschwalbe.patcan.compiler.Source;
import typesafeschwalbe.patcan.compiler.Symbol;
import typesafeschwalbe.patcan.types.DataType;
import typesafeschwalbe.patcan.types.LambdaSet;
import typesafeschwalbe.patcan.types.OpaqueDef;
import typesafeschwalbe.patcan.types.Variable;

public class Pattern {

    public static record TagName(String name, Optional<Symbol> privateSymbol) {

        public static TagName global(String name) {
            return new TagName(name, Optional.empty());
        }

        public static TagName privateTag(String name, Symbol symbol) {
            return new TagName(name, Optional.of(symbol));
        }

        public boolean isPrivate() {
            return this.privateSymbol.isPresent();
        }

        @Override
        public String toString() {
            return this.privateSymbol.isPresent()
                ? "$" + this.name + "(" + this.privateSymbol.get() + ")"
                : this.name;
        }
    }

    public static record Argument(Variable variable, Pattern pattern) {}

    public static record Identifier(
        Symbol symbol
    ) {}

    public static record AppliedTag(
        Variable wholeVar,
        Variable extVar,
        TagName tagName,
        List<Argument> arguments
    ) {}

    public static record UnwrappedOpaque(
        Variable wholeVar,
        Symbol opaque,
        Argument argument,
        DataType specializedDefType,
        List<OpaqueDef.TypeArgument> typeArguments,
        List<LambdaSet> lambdaSetVariables
    ) {}

    public static record RecordDestructure(
        Variable wholeVar,
        Variable extVar,
        List<RecordDestruct> destructs
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

    public static record StrLiteral(
        String text
    ) {}

    public static record SingleQuote(
        int codePoint
    ) {}

    public static record AbilityMemberSpecialization(
        Symbol ident,
        Symbol specializes
    ) {}

    public static record Shadowed(
        Source originalRegion,
        Loc<String> shadow,
        Symbol newSymbol
    ) {}

    public static record OpaqueNotInScope(
        Loc<String> name
    ) {}

    public static record UnsupportedPattern(
        Source region
    ) {}

    public static record MalformedPattern(
        MalformedPatternProblem problem,
        Source region
    ) {}

    public enum Type {
        IDENTIFIER,                    // Identifier
        APPLIED_TAG,                   // AppliedTag
        UNWRAPPED_OPAQUE,              // UnwrappedOpaque
        RECORD_DESTRUCTURE,            // RecordDestructure
        NUM_LITERAL,                   // NumLiteral
        INT_LITERAL,                   // IntLiteral
        FLOAT_LITERAL,                 // FloatLiteral
        STR_LITERAL,                   // StrLiteral
        SINGLE_QUOTE,                  // SingleQuote
        UNDERSCORE,                    // = null
        ABILITY_MEMBER_SPECIALIZATION, // AbilityMemberSpecialization
        SHADOWED,                      // Shadowed
        OPAQUE_NOT_IN_SCOPE,           // OpaqueNotInScope
        UNSUPPORTED_PATTERN,           // UnsupportedPattern
        MALFORMED_PATTERN              // MalformedPattern
    }

    public final Type type;
    private final Object value;
    public final Source source;

    public Pattern(Type type, Object value, Source source) {
        this.type = type;
        this.value = value;
        this.source = source;
    }

    @SuppressWarnings("unchecked")
    public <T> T getValue() {
        return (T) this.value;
    }

    public boolean isRuntimeError() {
        switch(this.type) {
            case SHADOWED:
            case OPAQUE_NOT_IN_SCOPE:
            case UNSUPPORTED_PATTERN:
            case MALFORMED_PATTERN:
                return true;
            default:
                return false;
        }
    }

    @Override
    public boolean equals(Object otherRaw) {
        if(!(otherRaw instanceof Pattern)) { return false; }
        Pattern other = (Pattern) otherRaw;
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
        if(this.value == null) {
            return this.type.toString();
        }
        return this.type + "(" + this.value + ")";
    }

}
