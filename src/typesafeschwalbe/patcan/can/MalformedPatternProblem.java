package typesafeschwalbe.patcan.can;

import java.util.Optional;

import typesafeschwalbe.patcan.frontend.BadIdent;
import typesafeschwalbe.patcan.frontend.Base;

public record MalformedPatternProblem(
    Kind kind, Optional<Base> base, Optional<BadIdent> badIdent
) {

    public enum Kind {
        MALFORMED_INT,
        MALFORMED_FLOAT,
        MALFORMED_BASE,
        EMPTY_SINGLE_QUOTE,
        MULTIPLE_CHARS_IN_SINGLE_QUOTE,
        INVALID_UNICODE_ESCAPE,
        UNKNOWN,
        QUALIFIED_IDENTIFIER,
        BAD_IDENT
    }

    public static MalformedPatternProblem of(Kind kind) {
        if(kind == Kind.MALFORMED_BASE || kind == Kind.BAD_IDENT) {
            throw new IllegalArgumentException(
                "'" + kind + "' needs additional information!"
            );
        }
        return new MalformedPatternProblem(
            kind, Optional.empty(), Optional.empty()
        );
    }

    public static MalformedPatternProblem malformedBase(Base base) {
        return new MalformedPatternProblem(
            Kind.MALFORMED_BASE, Optional.of(base), Optional.empty()
        );
    }

    public static MalformedPatternProblem badIdent(BadIdent problem) {
        return new MalformedPatternProblem(
            Kind.BAD_IDENT, Optional.empty(), Optional.of(problem)
        );
    }

    public String describe() {
        switch(this.kind) {
            case MALFORMED_INT:
                return "this integer literal is malformed or out of range";
            case MALFORMED_FLOAT:
                return "this float literal is malformed or out of range";
            case MALFORMED_BASE:
                return "this " + this.base.get()
                    + " integer literal is malformed or out of range";
            case EMPTY_SINGLE_QUOTE:
                return "this character literal is empty";
            case MULTIPLE_CHARS_IN_SINGLE_QUOTE:
                return "this character literal contains more than"
                    + " one character";
            case INVALID_UNICODE_ESCAPE:
                return "this unicode escape is not a valid code point";
            case UNKNOWN:
                return "this could not be parsed as a pattern";
            case QUALIFIED_IDENTIFIER:
                return "a qualified name can not be bound by a pattern";
            case BAD_IDENT:
                return "this is " + this.badIdent.get().description;
            default:
                throw new RuntimeException("unhandled problem!");
        }
    }

    @Override
    public String toString() {
        if(this.base.isPresent()) {
            return this.kind + "(" + this.base.get().name() + ")";
        }
        if(this.badIdent.isPresent()) {
            return this.kind + "(" + this.badIdent.get().name() + ")";
        }
        return this.kind.name();
    }

}
