package typesafeschwalbe.patcan.can;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import typesafeschwalbe.patcan.compiler.Error;
import typesafeschwalbe.patcan.compiler.Source;
import typesafeschwalbe.patcan.frontend.PatternType;

// A diagnostic recorded while canonicalizing. Problems never interrupt
// canonicalization; the offending node is replaced by a sentinel instead.
public class Problem {

    public static record Shadowing(
        Source originalRegion, Loc<String> shadow
    ) {}

    public static record UnsupportedPattern(
        PatternType patternType, Source region
    ) {}

    public static record MalformedPattern(
        MalformedPatternProblem problem, Source region
    ) {}

    public static record OpaqueNotDefined(
        Loc<String> usage,
        Set<String> opaquesInScope,
        Optional<Source> definedAlias
    ) {}

    public static record LookupNotInScope(
        Loc<String> name, Set<String> namesInScope
    ) {}

    public static record At(
        Source region
    ) {}

    public static record Named(
        Loc<String> name
    ) {}

    public enum Type {
        SHADOWING,                       // Shadowing
        UNSUPPORTED_PATTERN,             // UnsupportedPattern
        UNDERSCORE_IN_DEF,               // At
        MALFORMED_PATTERN,               // MalformedPattern
        OPAQUE_NOT_APPLIED,              // Named
        OPAQUE_NOT_DEFINED,              // OpaqueNotDefined
        OPAQUE_APPLIED_TO_MULTIPLE_ARGS, // At
        INTERPOLATION_IN_PATTERN,        // At
        LOOKUP_NOT_IN_SCOPE              // LookupNotInScope
    }

    public final Type type;
    private final Object value;

    private Problem(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Problem shadowing(Source originalRegion, Loc<String> shadow) {
        return new Problem(
            Type.SHADOWING, new Shadowing(originalRegion, shadow)
        );
    }

    public static Problem unsupportedPattern(
        PatternType patternType, Source region
    ) {
        return new Problem(
            Type.UNSUPPORTED_PATTERN,
            new UnsupportedPattern(patternType, region)
        );
    }

    public static Problem underscoreInDef(Source region) {
        return new Problem(Type.UNDERSCORE_IN_DEF, new At(region));
    }

    public static Problem malformedPattern(
        MalformedPatternProblem problem, Source region
    ) {
        return new Problem(
            Type.MALFORMED_PATTERN, new MalformedPattern(problem, region)
        );
    }

    public static Problem opaqueNotApplied(Loc<String> name) {
        return new Problem(Type.OPAQUE_NOT_APPLIED, new Named(name));
    }

    public static Problem opaqueNotDefined(
        Loc<String> usage, Set<String> opaquesInScope,
        Optional<Source> definedAlias
    ) {
        return new Problem(
            Type.OPAQUE_NOT_DEFINED,
            new OpaqueNotDefined(
                usage, new TreeSet<>(opaquesInScope), definedAlias
            )
        );
    }

    public static Problem opaqueAppliedToMultipleArgs(Source region) {
        return new Problem(Type.OPAQUE_APPLIED_TO_MULTIPLE_ARGS, new At(region));
    }

    public static Problem interpolationInPattern(Source region) {
        return new Problem(Type.INTERPOLATION_IN_PATTERN, new At(region));
    }

    public static Problem lookupNotInScope(
        Loc<String> name, Set<String> namesInScope
    ) {
        return new Problem(
            Type.LOOKUP_NOT_IN_SCOPE,
            new LookupNotInScope(name, new TreeSet<>(namesInScope))
        );
    }

    @SuppressWarnings("unchecked")
    public <T> T getValue() {
        return (T) this.value;
    }

    public Source region() {
        switch(this.type) {
            case SHADOWING: {
                Shadowing data = this.getValue();
                return data.shadow().region();
            }
            case UNSUPPORTED_PATTERN: {
                UnsupportedPattern data = this.getValue();
                return data.region();
            }
            case MALFORMED_PATTERN: {
                MalformedPattern data = this.getValue();
                return data.region();
            }
            case OPAQUE_NOT_APPLIED: {
                Named data = this.getValue();
                return data.name().region();
            }
            case OPAQUE_NOT_DEFINED: {
                OpaqueNotDefined data = this.getValue();
                return data.usage().region();
            }
            case LOOKUP_NOT_IN_SCOPE: {
                LookupNotInScope data = this.getValue();
                return data.name().region();
            }
            case UNDERSCORE_IN_DEF:
            case OPAQUE_APPLIED_TO_MULTIPLE_ARGS:
            case INTERPOLATION_IN_PATTERN: {
                At data = this.getValue();
                return data.region();
            }
            default:
                throw new RuntimeException("unhandled problem!");
        }
    }

    private static String listed(Set<String> names) {
        List<String> shown = names.stream().limit(4).toList();
        return String.join(", ", shown.stream().map(n -> "'" + n + "'").toList())
            + (names.size() > shown.size()? ", ..." : "");
    }

    public Error toError() {
        switch(this.type) {
            case SHADOWING: {
                Shadowing data = this.getValue();
                return new Error(
                    "Duplicate name",
                    Error.Marking.error(
                        data.shadow().region(),
                        "'" + data.shadow().value() + "' is already bound"
                    ),
                    Error.Marking.info(
                        data.originalRegion(), "previously bound here"
                    )
                );
            }
            case UNSUPPORTED_PATTERN: {
                UnsupportedPattern data = this.getValue();
                return new Error(
                    "Unsupported pattern",
                    "literals can only be matched in when branches",
                    Error.Marking.error(
                        data.region(),
                        "this pattern can not be used in "
                            + data.patternType().description
                    )
                );
            }
            case UNDERSCORE_IN_DEF: {
                At data = this.getValue();
                return new Error(
                    "Underscore in definition",
                    "give the value a name, even if it is never used",
                    Error.Marking.error(
                        data.region(), "a definition must bind a name"
                    )
                );
            }
            case MALFORMED_PATTERN: {
                MalformedPattern data = this.getValue();
                return new Error(
                    "Malformed pattern",
                    Error.Marking.error(
                        data.region(), data.problem().describe()
                    )
                );
            }
            case OPAQUE_NOT_APPLIED: {
                Named data = this.getValue();
                return new Error(
                    "Opaque reference without an argument",
                    "opaque types always wrap exactly one value",
                    Error.Marking.error(
                        data.name().region(),
                        "'@" + data.name().value() + "' needs to be applied"
                            + " to the pattern it wraps"
                    )
                );
            }
            case OPAQUE_NOT_DEFINED: {
                OpaqueNotDefined data = this.getValue();
                Error.Marking usage = Error.Marking.error(
                    data.usage().region(),
                    "there is no opaque type '" + data.usage().value()
                        + "' in scope"
                        + (data.opaquesInScope().isEmpty()
                            ? ""
                            : " (in scope: "
                                + Problem.listed(data.opaquesInScope()) + ")")
                );
                if(data.definedAlias().isPresent()) {
                    return new Error(
                        "Opaque type not in scope",
                        usage,
                        Error.Marking.info(
                            data.definedAlias().get(),
                            "'" + data.usage().value() + "' is defined here,"
                                + " but as an alias and not as an opaque type"
                        )
                    );
                }
                return new Error("Opaque type not in scope", usage);
            }
            case OPAQUE_APPLIED_TO_MULTIPLE_ARGS: {
                At data = this.getValue();
                return new Error(
                    "Opaque reference with multiple arguments",
                    "wrap the arguments into a record or tag instead",
                    Error.Marking.error(
                        data.region(),
                        "an opaque type wraps exactly one value"
                    )
                );
            }
            case INTERPOLATION_IN_PATTERN: {
                At data = this.getValue();
                return new Error(
                    "Interpolation in pattern",
                    Error.Marking.error(
                        data.region(),
                        "string patterns can not contain interpolations"
                    )
                );
            }
            case LOOKUP_NOT_IN_SCOPE: {
                LookupNotInScope data = this.getValue();
                return new Error(
                    "Unknown name",
                    Error.Marking.error(
                        data.name().region(),
                        "'" + data.name().value() + "' is not defined here"
                            + (data.namesInScope().isEmpty()
                                ? ""
                                : " (in scope: "
                                    + Problem.listed(data.namesInScope()) + ")")
                    )
                );
            }
            default:
                throw new RuntimeException("unhandled problem!");
        }
    }

    @Override
    public String toString() {
        return this.type + "(" + this.value + ")";
    }

}
