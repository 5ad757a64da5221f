package typesafeschwalbe.patcan.can;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

import typesafeschwalbe.patcan.compiler.Source;
import typesafeschwalbe.patcan.compiler.Symbol;
import typesafeschwalbe.patcan.frontend.AstPattern;
import typesafeschwalbe.patcan.frontend.PatternParser;
import typesafeschwalbe.patcan.frontend.PatternType;
import typesafeschwalbe.patcan.frontend.StrLiteral;
import typesafeschwalbe.patcan.frontend.StrSegment;
import typesafeschwalbe.patcan.types.OpaqueDef;
import typesafeschwalbe.patcan.types.VarStore;
import typesafeschwalbe.patcan.types.Variable;

// Turns parsed patterns into canonical patterns. Every name a pattern binds
// is introduced into the scope, and every problem is reported to the
// environment and replaced by a runtime error pattern, so canonicalizing a
// parsed pattern never fails.
public class PatternCanonicalizer {

    public static record Canonicalized(Output output, Pattern pattern) {}

    private final Env env;
    private final VarStore varStore;
    private final Scope scope;

    public PatternCanonicalizer(Env env, VarStore varStore, Scope scope) {
        this.env = env;
        this.varStore = varStore;
        this.scope = scope;
    }

    private Pattern shadowed(
        Scope.Introduction introduction, String name, Source region,
        Output output
    ) {
        Loc<String> shadow = Loc.at(region, name);
        Source originalRegion = introduction.originalRegion().get();
        this.env.problem(Problem.shadowing(originalRegion, shadow));
        output.references.boundSymbols.add(introduction.symbol());
        return new Pattern(
            Pattern.Type.SHADOWED,
            new Pattern.Shadowed(originalRegion, shadow, introduction.symbol()),
            region
        );
    }

    public Canonicalized canonicalizeDefHeaderPattern(
        AbilitiesStore abilities, PatternType patternType,
        AstPattern pattern, Source region
    ) {
        AstPattern unwrapped = pattern;
        while(unwrapped.type == AstPattern.Type.SPACE_BEFORE
                || unwrapped.type == AstPattern.Type.SPACE_AFTER) {
            AstPattern.Spaced data = unwrapped.getValue();
            unwrapped = data.inner();
        }
        if(unwrapped.type != AstPattern.Type.IDENTIFIER) {
            return this.canonicalizePattern(patternType, pattern, region);
        }
        AstPattern.Name data = unwrapped.getValue();
        Output output = new Output();
        Scope.Introduction introduction = this.scope
            .introduceOrShadowAbilityMember(data.name(), region, abilities);
        if(introduction.isShadowing()) {
            return new Canonicalized(
                output,
                this.shadowed(introduction, data.name(), region, output)
            );
        }
        output.references.boundSymbols.add(introduction.symbol());
        if(introduction.specializes().isPresent()) {
            return new Canonicalized(output, new Pattern(
                Pattern.Type.ABILITY_MEMBER_SPECIALIZATION,
                new Pattern.AbilityMemberSpecialization(
                    introduction.symbol(), introduction.specializes().get()
                ),
                region
            ));
        }
        return new Canonicalized(output, new Pattern(
            Pattern.Type.IDENTIFIER,
            new Pattern.Identifier(introduction.symbol()),
            region
        ));
    }

    public Canonicalized canonicalizePattern(
        PatternType patternType, AstPattern pattern
    ) {
        return this.canonicalizePattern(patternType, pattern, pattern.source);
    }

    public Canonicalized canonicalizePattern(
        PatternType patternType, AstPattern pattern, Source region
    ) {
        Output output = new Output();
        Pattern canPattern;
        switch(pattern.type) {
            case IDENTIFIER: {
                AstPattern.Name data = pattern.getValue();
                Scope.Introduction introduction = this.scope
                    .introduce(data.name(), region);
                if(introduction.isShadowing()) {
                    canPattern = this.shadowed(
                        introduction, data.name(), region, output
                    );
                    break;
                }
                output.references.boundSymbols.add(introduction.symbol());
                canPattern = new Pattern(
                    Pattern.Type.IDENTIFIER,
                    new Pattern.Identifier(introduction.symbol()),
                    region
                );
                break;
            }
            case GLOBAL_TAG:
            case PRIVATE_TAG: {
                canPattern = new Pattern(
                    Pattern.Type.APPLIED_TAG,
                    new Pattern.AppliedTag(
                        this.varStore.fresh(), this.varStore.fresh(),
                        this.tagName(pattern), List.of()
                    ),
                    region
                );
                break;
            }
            case OPAQUE_REF: {
                AstPattern.Name data = pattern.getValue();
                this.env.problem(Problem.opaqueNotApplied(
                    Loc.at(region, data.name())
                ));
                canPattern = this.unsupported(region);
                break;
            }
            case APPLY: {
                AstPattern.Apply data = pattern.getValue();
                canPattern = this.canonicalizeApply(
                    patternType, data, region, output
                );
                break;
            }
            case FLOAT_LITERAL: {
                if(patternType != PatternType.WHEN_BRANCH) {
                    canPattern = this.unsupportedIn(patternType, region);
                    break;
                }
                AstPattern.Literal data = pattern.getValue();
                NumLiterals.ParsedFloat parsed;
                try {
                    parsed = NumLiterals.finishParsingFloat(data.text());
                } catch(NumLiterals.MalformedLiteralException e) {
                    canPattern = this.malformed(
                        MalformedPatternProblem.of(
                            MalformedPatternProblem.Kind.MALFORMED_FLOAT
                        ),
                        region
                    );
                    break;
                }
                canPattern = new Pattern(
                    Pattern.Type.FLOAT_LITERAL,
                    new Pattern.FloatLiteral(
                        this.varStore.fresh(), this.varStore.fresh(),
                        parsed.textWithoutSuffix(), parsed.value(),
                        parsed.bound()
                    ),
                    region
                );
                break;
            }
            case UNDERSCORE: {
                switch(patternType) {
                    case WHEN_BRANCH:
                    case FUNCTION_ARG:
                        canPattern = new Pattern(
                            Pattern.Type.UNDERSCORE, null, region
                        );
                        break;
                    case TOP_LEVEL_DEF:
                    case DEF_EXPR:
                        this.env.problem(Problem.underscoreInDef(region));
                        canPattern = this.unsupported(region);
                        break;
                    default:
                        throw new RuntimeException("unhandled pattern type!");
                }
                break;
            }
            case NUM_LITERAL: {
                if(patternType != PatternType.WHEN_BRANCH) {
                    canPattern = this.unsupportedIn(patternType, region);
                    break;
                }
                AstPattern.Literal data = pattern.getValue();
                canPattern = this.canonicalizeNum(data.text(), region);
                break;
            }
            case NON_BASE10_LITERAL: {
                if(patternType != PatternType.WHEN_BRANCH) {
                    canPattern = this.unsupportedIn(patternType, region);
                    break;
                }
                AstPattern.NonBase10 data = pattern.getValue();
                canPattern = this.canonicalizeBase(data, region);
                break;
            }
            case STR_LITERAL: {
                if(patternType != PatternType.WHEN_BRANCH) {
                    canPattern = this.unsupportedIn(patternType, region);
                    break;
                }
                StrLiteral data = pattern.getValue();
                canPattern = this.flattenStrLiteral(data, region);
                break;
            }
            case SINGLE_QUOTE: {
                if(patternType != PatternType.WHEN_BRANCH) {
                    canPattern = this.unsupportedIn(patternType, region);
                    break;
                }
                AstPattern.Literal data = pattern.getValue();
                canPattern = this.canonicalizeSingleQuote(data.text(), region);
                break;
            }
            case SPACE_BEFORE:
            case SPACE_AFTER: {
                AstPattern.Spaced data = pattern.getValue();
                return this.canonicalizePattern(
                    patternType, data.inner(), region
                );
            }
            case RECORD_DESTRUCTURE: {
                AstPattern.Fields data = pattern.getValue();
                canPattern = this.canonicalizeRecordDestructure(
                    patternType, data, region, output
                );
                break;
            }
            case REQUIRED_FIELD:
            case OPTIONAL_FIELD: {
                throw new IllegalStateException(
                    "Record fields may only appear in a record destructure!"
                );
            }
            case MALFORMED: {
                canPattern = this.malformed(
                    MalformedPatternProblem.of(
                        MalformedPatternProblem.Kind.UNKNOWN
                    ),
                    region
                );
                break;
            }
            case MALFORMED_IDENT: {
                AstPattern.MalformedIdent data = pattern.getValue();
                canPattern = this.malformed(
                    MalformedPatternProblem.badIdent(data.problem()), region
                );
                break;
            }
            case QUALIFIED_IDENTIFIER: {
                canPattern = this.malformed(
                    MalformedPatternProblem.of(
                        MalformedPatternProblem.Kind.QUALIFIED_IDENTIFIER
                    ),
                    region
                );
                break;
            }
            default:
                throw new RuntimeException("unhandled pattern type!");
        }
        return new Canonicalized(output, canPattern);
    }

    private Pattern.TagName tagName(AstPattern tag) {
        AstPattern.Name data = tag.getValue();
        if(tag.type == AstPattern.Type.PRIVATE_TAG) {
            return Pattern.TagName.privateTag(
                data.name(), this.env.intern(data.name())
            );
        }
        return Pattern.TagName.global(data.name());
    }

    private Pattern canonicalizeApply(
        PatternType patternType, AstPattern.Apply data, Source region,
        Output output
    ) {
        List<Pattern.Argument> arguments = new ArrayList<>();
        for(AstPattern argument: data.arguments()) {
            Canonicalized canArgument = this.canonicalizePattern(
                patternType, argument, argument.source
            );
            output.union(canArgument.output());
            arguments.add(new Pattern.Argument(
                this.varStore.fresh(), canArgument.pattern()
            ));
        }
        AstPattern tag = data.tag();
        switch(tag.type) {
            case GLOBAL_TAG:
            case PRIVATE_TAG: {
                return new Pattern(
                    Pattern.Type.APPLIED_TAG,
                    new Pattern.AppliedTag(
                        this.varStore.fresh(), this.varStore.fresh(),
                        this.tagName(tag), arguments
                    ),
                    region
                );
            }
            case OPAQUE_REF: {
                AstPattern.Name name = tag.getValue();
                Scope.OpaqueLookup lookup = this.scope
                    .lookupOpaqueRef(name.name(), tag.source);
                if(!lookup.isFound()) {
                    this.env.problem(lookup.getProblem());
                    return new Pattern(
                        Pattern.Type.OPAQUE_NOT_IN_SCOPE,
                        new Pattern.OpaqueNotInScope(
                            Loc.at(tag.source, name.name())
                        ),
                        region
                    );
                }
                if(arguments.isEmpty()) {
                    throw new IllegalStateException(
                        "An applied opaque reference has no arguments!"
                    );
                }
                if(arguments.size() > 1) {
                    this.env.problem(
                        Problem.opaqueAppliedToMultipleArgs(region)
                    );
                    return this.unsupported(region);
                }
                Symbol opaque = lookup.getSymbol();
                OpaqueDef.Freshened freshened = lookup.getOpaqueDef()
                    .freshen(this.varStore);
                output.references.referencedTypeDefs.add(opaque);
                output.references.typeLookups.add(opaque);
                return new Pattern(
                    Pattern.Type.UNWRAPPED_OPAQUE,
                    new Pattern.UnwrappedOpaque(
                        this.varStore.fresh(), opaque, arguments.get(0),
                        freshened.specializedDefType(),
                        freshened.typeArguments(),
                        freshened.lambdaSetVariables()
                    ),
                    region
                );
            }
            default:
                throw new IllegalStateException(
                    "Only tags and opaque references can be applied!"
                );
        }
    }

    private Pattern canonicalizeNum(String text, Source region) {
        NumLiterals.ParsedNum parsed;
        try {
            parsed = NumLiterals.finishParsingNum(text);
        } catch(NumLiterals.MalformedLiteralException e) {
            return this.malformed(
                MalformedPatternProblem.of(
                    MalformedPatternProblem.Kind.MALFORMED_INT
                ),
                region
            );
        }
        switch(parsed.type) {
            case UNKNOWN_NUM:
                return new Pattern(
                    Pattern.Type.NUM_LITERAL,
                    new Pattern.NumLiteral(
                        this.varStore.fresh(), text,
                        parsed.intValue, parsed.numericBound
                    ),
                    region
                );
            case INT:
                return new Pattern(
                    Pattern.Type.INT_LITERAL,
                    new Pattern.IntLiteral(
                        this.varStore.fresh(), this.varStore.fresh(), text,
                        parsed.intValue, parsed.intBound
                    ),
                    region
                );
            case FLOAT:
                return new Pattern(
                    Pattern.Type.FLOAT_LITERAL,
                    new Pattern.FloatLiteral(
                        this.varStore.fresh(), this.varStore.fresh(), text,
                        parsed.floatValue, parsed.floatBound
                    ),
                    region
                );
            default:
                throw new RuntimeException("unhandled number kind!");
        }
    }

    private Pattern canonicalizeBase(AstPattern.NonBase10 data, Source region) {
        NumLiterals.ParsedInt parsed;
        try {
            parsed = NumLiterals.finishParsingBase(
                data.digits(), data.base(), data.isNegative()
            );
        } catch(NumLiterals.MalformedLiteralException e) {
            return this.malformed(
                MalformedPatternProblem.malformedBase(data.base()), region
            );
        }
        NumLiterals.IntValue value = parsed.value();
        if(data.isNegative() && value.isU128()) {
            // no supported integer type holds the negation of a u128
            return this.malformed(
                MalformedPatternProblem.of(
                    MalformedPatternProblem.Kind.MALFORMED_INT
                ),
                region
            );
        }
        if(data.isNegative()) {
            value = value.negate();
        }
        return new Pattern(
            Pattern.Type.INT_LITERAL,
            new Pattern.IntLiteral(
                this.varStore.fresh(), this.varStore.fresh(),
                value.value().toString(), value, parsed.bound()
            ),
            region
        );
    }

    private Pattern canonicalizeSingleQuote(String text, Source region) {
        int codePoints = text.codePointCount(0, text.length());
        if(codePoints == 0) {
            return this.malformed(
                MalformedPatternProblem.of(
                    MalformedPatternProblem.Kind.EMPTY_SINGLE_QUOTE
                ),
                region
            );
        }
        if(codePoints > 1) {
            return this.malformed(
                MalformedPatternProblem.of(
                    MalformedPatternProblem.Kind.MULTIPLE_CHARS_IN_SINGLE_QUOTE
                ),
                region
            );
        }
        return new Pattern(
            Pattern.Type.SINGLE_QUOTE,
            new Pattern.SingleQuote(text.codePointAt(0)),
            region
        );
    }

    private Pattern flattenStrLiteral(StrLiteral literal, Source region) {
        StringBuilder text = new StringBuilder();
        for(List<StrSegment> line: literal.lines()) {
            for(StrSegment segment: line) {
                switch(segment.type) {
                    case PLAINTEXT: {
                        StrSegment.Plaintext data = segment.getValue();
                        text.append(data.text());
                        break;
                    }
                    case ESCAPED_CHAR: {
                        StrSegment.EscapedChar data = segment.getValue();
                        text.append(PatternParser.unescape(data.escaped()));
                        break;
                    }
                    case UNICODE: {
                        StrSegment.Unicode data = segment.getValue();
                        OptionalInt codePoint = ExprCanonicalizer
                            .decodeUnicode(data.hexDigits());
                        if(codePoint.isEmpty()) {
                            Problem problem = Problem.malformedPattern(
                                MalformedPatternProblem.of(
                                    MalformedPatternProblem.Kind
                                        .INVALID_UNICODE_ESCAPE
                                ),
                                segment.source
                            );
                            this.env.problem(problem);
                            return new Pattern(
                                Pattern.Type.MALFORMED_PATTERN,
                                new Pattern.MalformedPattern(
                                    MalformedPatternProblem.of(
                                        MalformedPatternProblem.Kind
                                            .INVALID_UNICODE_ESCAPE
                                    ),
                                    segment.source
                                ),
                                region
                            );
                        }
                        text.appendCodePoint(codePoint.getAsInt());
                        break;
                    }
                    case INTERPOLATED: {
                        this.env.problem(
                            Problem.interpolationInPattern(segment.source)
                        );
                        return new Pattern(
                            Pattern.Type.UNSUPPORTED_PATTERN,
                            new Pattern.UnsupportedPattern(segment.source),
                            region
                        );
                    }
                    default:
                        throw new RuntimeException("unhandled segment type!");
                }
            }
        }
        return new Pattern(
            Pattern.Type.STR_LITERAL,
            new Pattern.StrLiteral(text.toString()),
            region
        );
    }

    private Pattern canonicalizeRecordDestructure(
        PatternType patternType, AstPattern.Fields data, Source region,
        Output output
    ) {
        Variable extVar = this.varStore.fresh();
        Variable wholeVar = this.varStore.fresh();
        List<RecordDestruct> destructs = new ArrayList<>();
        // the first conflict replaces the whole destructure
        Optional<Pattern> erroneous = Optional.empty();
        for(AstPattern field: data.fields()) {
            AstPattern unwrapped = field;
            while(unwrapped.type == AstPattern.Type.SPACE_BEFORE
                    || unwrapped.type == AstPattern.Type.SPACE_AFTER) {
                AstPattern.Spaced spaced = unwrapped.getValue();
                unwrapped = spaced.inner();
            }
            switch(unwrapped.type) {
                case IDENTIFIER: {
                    AstPattern.Name name = unwrapped.getValue();
                    Scope.Introduction introduction = this.scope
                        .introduce(name.name(), field.source);
                    if(introduction.isShadowing()) {
                        Pattern shadowed = this.shadowed(
                            introduction, name.name(), field.source, output
                        );
                        if(erroneous.isEmpty()) {
                            erroneous = Optional.of(shadowed);
                        }
                        break;
                    }
                    output.references.boundSymbols.add(introduction.symbol());
                    destructs.add(new RecordDestruct(
                        this.varStore.fresh(), name.name(),
                        introduction.symbol(), RecordDestruct.Kind.REQUIRED,
                        field.source
                    ));
                    break;
                }
                case REQUIRED_FIELD: {
                    AstPattern.RequiredField required = unwrapped.getValue();
                    // the label itself is not bound, only the guard's names
                    Symbol symbol = this.scope.ignore(required.label());
                    Canonicalized canGuard = this.canonicalizePattern(
                        patternType, required.guard(), required.guard().source
                    );
                    output.union(canGuard.output());
                    Variable variable = this.varStore.fresh();
                    destructs.add(new RecordDestruct(
                        variable, required.label(), symbol,
                        RecordDestruct.Kind.guard(
                            this.varStore.fresh(), canGuard.pattern()
                        ),
                        field.source
                    ));
                    break;
                }
                case OPTIONAL_FIELD: {
                    AstPattern.OptionalField optional = unwrapped.getValue();
                    Scope.Introduction introduction = this.scope
                        .introduce(optional.label(), field.source);
                    if(introduction.isShadowing()) {
                        Pattern shadowed = this.shadowed(
                            introduction, optional.label(), field.source,
                            output
                        );
                        if(erroneous.isEmpty()) {
                            erroneous = Optional.of(shadowed);
                        }
                        break;
                    }
                    ExprCanonicalizer.Canonicalized canDefault
                        = new ExprCanonicalizer(
                            this.env, this.varStore, this.scope
                        ).canonicalize(optional.defaultValue());
                    output.references.boundSymbols.add(introduction.symbol());
                    output.union(canDefault.output());
                    Variable variable = this.varStore.fresh();
                    destructs.add(new RecordDestruct(
                        variable, optional.label(), introduction.symbol(),
                        RecordDestruct.Kind.optional(
                            this.varStore.fresh(), canDefault.expr()
                        ),
                        field.source
                    ));
                    break;
                }
                default:
                    throw new IllegalStateException(
                        "A record destructure may only contain fields!"
                    );
            }
        }
        if(erroneous.isPresent()) {
            Pattern.Shadowed first = erroneous.get().getValue();
            return new Pattern(Pattern.Type.SHADOWED, first, region);
        }
        return new Pattern(
            Pattern.Type.RECORD_DESTRUCTURE,
            new Pattern.RecordDestructure(wholeVar, extVar, destructs),
            region
        );
    }

    private Pattern unsupported(Source region) {
        return new Pattern(
            Pattern.Type.UNSUPPORTED_PATTERN,
            new Pattern.UnsupportedPattern(region),
            region
        );
    }

    private Pattern unsupportedIn(PatternType patternType, Source region) {
        this.env.problem(Problem.unsupportedPattern(patternType, region));
        return this.unsupported(region);
    }

    private Pattern malformed(MalformedPatternProblem problem, Source region) {
        this.env.problem(Problem.malformedPattern(problem, region));
        return new Pattern(
            Pattern.Type.MALFORMED_PATTERN,
            new Pattern.MalformedPattern(problem, region),
            region
        );
    }

}
