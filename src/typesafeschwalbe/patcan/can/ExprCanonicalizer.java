package typesafeschwalbe.patcan.can;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.TreeMap;

import typesafeschwalbe.patcan.compiler.Source;
import typesafeschwalbe.patcan.compiler.Symbol;
import typesafeschwalbe.patcan.frontend.AstExpr;
import typesafeschwalbe.patcan.frontend.PatternParser;
import typesafeschwalbe.patcan.frontend.StrLiteral;
import typesafeschwalbe.patcan.frontend.StrSegment;
import typesafeschwalbe.patcan.types.VarStore;

public class ExprCanonicalizer {

    public static record Canonicalized(Output output, Expr expr) {}

    private final Env env;
    private final VarStore varStore;
    private final Scope scope;

    public ExprCanonicalizer(Env env, VarStore varStore, Scope scope) {
        this.env = env;
        this.varStore = varStore;
        this.scope = scope;
    }

    public static OptionalInt decodeUnicode(String hexDigits) {
        if(hexDigits.isEmpty() || hexDigits.length() > 6) {
            return OptionalInt.empty();
        }
        int codePoint = 0;
        for(int charIdx = 0; charIdx < hexDigits.length(); charIdx += 1) {
            int digit = Character.digit(hexDigits.charAt(charIdx), 16);
            if(digit == -1) {
                return OptionalInt.empty();
            }
            codePoint = codePoint * 16 + digit;
        }
        boolean isSurrogate = codePoint >= 0xD800 && codePoint <= 0xDFFF;
        if(!Character.isValidCodePoint(codePoint) || isSurrogate) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(codePoint);
    }

    private Expr runtimeError(Problem problem, Source source) {
        this.env.problem(problem);
        return new Expr(
            Expr.Type.RUNTIME_ERROR, new Expr.RuntimeError(problem), source
        );
    }

    private Expr malformed(MalformedPatternProblem.Kind kind, Source source) {
        return this.runtimeError(
            Problem.malformedPattern(MalformedPatternProblem.of(kind), source),
            source
        );
    }

    public Canonicalized canonicalize(AstExpr expr) {
        Output output = new Output();
        switch(expr.type) {
            case VARIABLE_ACCESS: {
                AstExpr.VariableAccess data = expr.getValue();
                Optional<Symbol> symbol = this.scope.lookup(data.variableName());
                if(symbol.isEmpty()) {
                    return new Canonicalized(output, this.runtimeError(
                        Problem.lookupNotInScope(
                            Loc.at(expr.source, data.variableName()),
                            this.scope.namesInScope()
                        ),
                        expr.source
                    ));
                }
                output.references.valueLookups.add(symbol.get());
                return new Canonicalized(output, new Expr(
                    Expr.Type.VAR, new Expr.Var(symbol.get()), expr.source
                ));
            }
            case NUM_LITERAL: {
                AstExpr.SimpleLiteral data = expr.getValue();
                NumLiterals.ParsedNum parsed;
                try {
                    parsed = NumLiterals.finishParsingNum(data.value());
                } catch(NumLiterals.MalformedLiteralException e) {
                    return new Canonicalized(output, this.malformed(
                        MalformedPatternProblem.Kind.MALFORMED_INT, expr.source
                    ));
                }
                return new Canonicalized(
                    output, this.numExpr(data.value(), parsed, expr.source)
                );
            }
            case FLOAT_LITERAL: {
                AstExpr.SimpleLiteral data = expr.getValue();
                NumLiterals.ParsedFloat parsed;
                try {
                    parsed = NumLiterals.finishParsingFloat(data.value());
                } catch(NumLiterals.MalformedLiteralException e) {
                    return new Canonicalized(output, this.malformed(
                        MalformedPatternProblem.Kind.MALFORMED_FLOAT,
                        expr.source
                    ));
                }
                return new Canonicalized(output, new Expr(
                    Expr.Type.FLOAT_LITERAL,
                    new Expr.FloatLiteral(
                        this.varStore.fresh(), this.varStore.fresh(),
                        parsed.textWithoutSuffix(), parsed.value(),
                        parsed.bound()
                    ),
                    expr.source
                ));
            }
            case STR_LITERAL: {
                StrLiteral data = expr.getValue();
                return this.canonicalizeStr(data, expr.source);
            }
            case TAG: {
                AstExpr.Tag data = expr.getValue();
                List<Expr.Argument> arguments = new ArrayList<>();
                for(AstExpr argument: data.arguments()) {
                    Canonicalized canArgument = this.canonicalize(argument);
                    output.union(canArgument.output());
                    arguments.add(new Expr.Argument(
                        this.varStore.fresh(), canArgument.expr()
                    ));
                }
                return new Canonicalized(output, new Expr(
                    Expr.Type.TAG,
                    new Expr.Tag(
                        this.varStore.fresh(), this.varStore.fresh(),
                        data.tagName(), arguments
                    ),
                    expr.source
                ));
            }
            case RECORD: {
                AstExpr.RecordLiteral data = expr.getValue();
                Map<String, Expr.Field> fields = new TreeMap<>();
                for(Map.Entry<String, AstExpr> field: data.fields().entrySet()) {
                    Canonicalized canField = this.canonicalize(field.getValue());
                    output.union(canField.output());
                    fields.put(field.getKey(), new Expr.Field(
                        this.varStore.fresh(), canField.expr()
                    ));
                }
                return new Canonicalized(output, new Expr(
                    Expr.Type.RECORD,
                    new Expr.RecordLiteral(this.varStore.fresh(), fields),
                    expr.source
                ));
            }
            default:
                throw new RuntimeException("unhandled expression type!");
        }
    }

    private Expr numExpr(
        String text, NumLiterals.ParsedNum parsed, Source source
    ) {
        switch(parsed.type) {
            case UNKNOWN_NUM:
                return new Expr(
                    Expr.Type.NUM_LITERAL,
                    new Expr.NumLiteral(
                        this.varStore.fresh(), text,
                        parsed.intValue, parsed.numericBound
                    ),
                    source
                );
            case INT:
                return new Expr(
                    Expr.Type.INT_LITERAL,
                    new Expr.IntLiteral(
                        this.varStore.fresh(), this.varStore.fresh(), text,
                        parsed.intValue, parsed.intBound
                    ),
                    source
                );
            case FLOAT:
                return new Expr(
                    Expr.Type.FLOAT_LITERAL,
                    new Expr.FloatLiteral(
                        this.varStore.fresh(), this.varStore.fresh(), text,
                        parsed.floatValue, parsed.floatBound
                    ),
                    source
                );
            default:
                throw new RuntimeException("unhandled number kind!");
        }
    }

    private Canonicalized canonicalizeStr(StrLiteral literal, Source source) {
        Output output = new Output();
        List<Expr> segments = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        Source textStart = null;
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
                            return new Canonicalized(output, this.malformed(
                                MalformedPatternProblem.Kind
                                    .INVALID_UNICODE_ESCAPE,
                                segment.source
                            ));
                        }
                        text.appendCodePoint(codePoint.getAsInt());
                        break;
                    }
                    case INTERPOLATED: {
                        StrSegment.Interpolated data = segment.getValue();
                        if(text.length() > 0) {
                            segments.add(new Expr(
                                Expr.Type.STR,
                                new Expr.Str(text.toString()),
                                textStart == null? segment.source : textStart
                            ));
                            text.setLength(0);
                        }
                        Canonicalized canInner = this.canonicalize(
                            data.expression()
                        );
                        output.union(canInner.output());
                        segments.add(canInner.expr());
                        textStart = null;
                        continue;
                    }
                    default:
                        throw new RuntimeException("unhandled segment type!");
                }
                if(textStart == null) {
                    textStart = segment.source;
                }
            }
        }
        if(segments.isEmpty()) {
            return new Canonicalized(output, new Expr(
                Expr.Type.STR, new Expr.Str(text.toString()), source
            ));
        }
        if(text.length() > 0) {
            segments.add(new Expr(
                Expr.Type.STR, new Expr.Str(text.toString()), textStart
            ));
        }
        return new Canonicalized(output, new Expr(
            Expr.Type.STR_INTERPOLATION,
            new Expr.StrInterpolation(segments),
            source
        ));
    }

}
