package typesafeschwalbe.patcan.can;

import java.util.ArrayList;
import java.util.List;

import typesafeschwalbe.patcan.compiler.Source;
import typesafeschwalbe.patcan.compiler.Symbol;

public class PatternSymbols {

    public static record Binding(Symbol symbol, Source region) {}

    public static List<Symbol> symbolsFromPattern(Pattern pattern) {
        List<Symbol> symbols = new ArrayList<>();
        PatternSymbols.collectSymbols(pattern, symbols);
        return symbols;
    }

    private static void collectSymbols(Pattern pattern, List<Symbol> symbols) {
        switch(pattern.type) {
            case IDENTIFIER: {
                Pattern.Identifier data = pattern.getValue();
                symbols.add(data.symbol());
                return;
            }
            case SHADOWED: {
                Pattern.Shadowed data = pattern.getValue();
                symbols.add(data.newSymbol());
                return;
            }
            case ABILITY_MEMBER_SPECIALIZATION: {
                Pattern.AbilityMemberSpecialization data = pattern.getValue();
                symbols.add(data.ident());
                symbols.add(data.specializes());
                return;
            }
            case APPLIED_TAG: {
                Pattern.AppliedTag data = pattern.getValue();
                for(Pattern.Argument argument: data.arguments()) {
                    PatternSymbols.collectSymbols(argument.pattern(), symbols);
                }
                return;
            }
            case UNWRAPPED_OPAQUE: {
                Pattern.UnwrappedOpaque data = pattern.getValue();
                symbols.add(data.opaque());
                PatternSymbols.collectSymbols(
                    data.argument().pattern(), symbols
                );
                return;
            }
            case RECORD_DESTRUCTURE: {
                Pattern.RecordDestructure data = pattern.getValue();
                for(RecordDestruct destruct: data.destructs()) {
                    if(destruct.kind().type == RecordDestruct.Kind.Type.GUARD) {
                        RecordDestruct.Guard guard = destruct.kind().getValue();
                        PatternSymbols.collectSymbols(guard.guard(), symbols);
                    } else {
                        symbols.add(destruct.symbol());
                    }
                }
                return;
            }
            case NUM_LITERAL:
            case INT_LITERAL:
            case FLOAT_LITERAL:
            case STR_LITERAL:
            case SINGLE_QUOTE:
            case UNDERSCORE:
            case MALFORMED_PATTERN:
            case UNSUPPORTED_PATTERN:
            case OPAQUE_NOT_IN_SCOPE:
                return;
            default:
                throw new RuntimeException("unhandled pattern type!");
        }
    }

    // Like 'symbolsFromPattern' for a sequence of patterns,
    // but keeps the order and pairs each symbol with the region of the
    // pattern that binds it.
    public static List<Binding> bindingsFromPatterns(List<Pattern> patterns) {
        List<Binding> bindings = new ArrayList<>();
        for(Pattern pattern: patterns) {
            PatternSymbols.collectBindings(pattern.source, pattern, bindings);
        }
        return bindings;
    }

    private static void collectBindings(
        Source region, Pattern pattern, List<Binding> bindings
    ) {
        switch(pattern.type) {
            case IDENTIFIER: {
                Pattern.Identifier data = pattern.getValue();
                bindings.add(new Binding(data.symbol(), region));
                return;
            }
            case SHADOWED: {
                Pattern.Shadowed data = pattern.getValue();
                bindings.add(new Binding(data.newSymbol(), region));
                return;
            }
            case ABILITY_MEMBER_SPECIALIZATION: {
                Pattern.AbilityMemberSpecialization data = pattern.getValue();
                bindings.add(new Binding(data.ident(), region));
                return;
            }
            case APPLIED_TAG: {
                Pattern.AppliedTag data = pattern.getValue();
                for(Pattern.Argument argument: data.arguments()) {
                    PatternSymbols.collectBindings(
                        argument.pattern().source, argument.pattern(), bindings
                    );
                }
                return;
            }
            case UNWRAPPED_OPAQUE: {
                Pattern.UnwrappedOpaque data = pattern.getValue();
                Pattern argument = data.argument().pattern();
                PatternSymbols.collectBindings(
                    argument.source, argument, bindings
                );
                bindings.add(new Binding(data.opaque(), region));
                return;
            }
            case RECORD_DESTRUCTURE: {
                Pattern.RecordDestructure data = pattern.getValue();
                for(RecordDestruct destruct: data.destructs()) {
                    if(destruct.kind().type == RecordDestruct.Kind.Type.GUARD) {
                        RecordDestruct.Guard guard = destruct.kind().getValue();
                        PatternSymbols.collectBindings(
                            guard.guard().source, guard.guard(), bindings
                        );
                    } else {
                        bindings.add(
                            new Binding(destruct.symbol(), destruct.source())
                        );
                    }
                }
                return;
            }
            case NUM_LITERAL:
            case INT_LITERAL:
            case FLOAT_LITERAL:
            case STR_LITERAL:
            case SINGLE_QUOTE:
            case UNDERSCORE:
            case MALFORMED_PATTERN:
            case UNSUPPORTED_PATTERN:
            case OPAQUE_NOT_IN_SCOPE:
                return;
            default:
                throw new RuntimeException("unhandled pattern type!");
        }
    }

    private PatternSymbols() {}

}
