package typesafeschwalbe.patcan.frontend;

import java.util.List;

import typesafeschwalbe.patcan.compiler.Source;

public class AstPattern {

    public static record Name(
        String name
    ) {}

    public static record Apply(
        AstPattern tag,
        List<AstPattern> arguments
    ) {}

    public static record Literal(
        String text
    ) {}

    public static record NonBase10(
        String digits,
        Base base,
        boolean isNegative
    ) {}

    public static record Fields(
        List<AstPattern> fields
    ) {}

    public static record RequiredField(
        String label,
        AstPattern guard
    ) {}

    public static record OptionalField(
        String label,
        AstExpr defaultValue
    ) {}

    public static record Spaced(
        AstPattern inner,
        List<String> trivia
    ) {}

    public static record MalformedIdent(
        String text,
        BadIdent problem
    ) {}

    public static record Qualified(
        String moduleName,
        String ident
    ) {}

    public enum Type {
        IDENTIFIER,           // Name
        GLOBAL_TAG,           // Name
        PRIVATE_TAG,          // Name
        OPAQUE_REF,           // Name
        APPLY,                // Apply
        NUM_LITERAL,          // Literal
        FLOAT_LITERAL,        // Literal
        NON_BASE10_LITERAL,   // NonBase10
        STR_LITERAL,          // StrLiteral
        SINGLE_QUOTE,         // Literal
        UNDERSCORE,           // Name
        RECORD_DESTRUCTURE,   // Fields
        REQUIRED_FIELD,       // RequiredField
        OPTIONAL_FIELD,       // OptionalField
        SPACE_BEFORE,         // Spaced
        SPACE_AFTER,          // Spaced
        MALFORMED,            // Literal
        MALFORMED_IDENT,      // MalformedIdent
        QUALIFIED_IDENTIFIER  // Qualified
    }

    public final Type type;
    private final Object value;
    public final Source source;

    public AstPattern(Type type, Object value, Source source) {
        this.type = type;
        this.value = value;
        this.source = source;
    }

    @SuppressWarnings("unchecked")
    public <T> T getValue() {
        return (T) this.value;
    }

    public boolean isTag() {
        switch(this.type) {
            case GLOBAL_TAG:
            case PRIVATE_TAG:
            case OPAQUE_REF:
                return true;
            default:
                return false;
        }
    }

    @Override
    public String toString() {
        return this.type + "(" + this.value + ")";
    }

}
