package typesafeschwalbe.patcan.can;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import typesafeschwalbe.patcan.compiler.ErrorException;
import typesafeschwalbe.patcan.compiler.Symbol;
import typesafeschwalbe.patcan.frontend.PatternType;
import typesafeschwalbe.patcan.types.DataType;
import typesafeschwalbe.patcan.types.OpaqueDef;

public class PatternSymbolsTest {

    private Fixtures fx;

    @BeforeEach
    void setup() {
        this.fx = new Fixtures();
    }

    private List<String> names(List<Symbol> symbols) {
        return symbols.stream().map(this.fx::nameOf).toList();
    }

    @Test
    @DisplayName("Tag arguments bind in source order at their own regions")
    void nestedTagBindings() throws ErrorException {
        Pattern pattern = this.fx.pattern(
            PatternType.FUNCTION_ARG, "Foo a (Bar b)"
        );
        List<PatternSymbols.Binding> bindings
            = PatternSymbols.bindingsFromPatterns(List.of(pattern));
        assertEquals(2, bindings.size());
        assertEquals("a", this.fx.nameOf(bindings.get(0).symbol()));
        assertEquals(Fixtures.at(4, 5), bindings.get(0).region());
        assertEquals("b", this.fx.nameOf(bindings.get(1).symbol()));
        assertEquals(Fixtures.at(11, 12), bindings.get(1).region());
    }

    @Test
    @DisplayName("A guarded field binds what its guard binds, not its label")
    void guardedFieldBindings() throws ErrorException {
        Pattern pattern = this.fx.pattern(
            PatternType.WHEN_BRANCH, "{ x, y: Just z }"
        );
        assertEquals(
            List.of("x", "z"),
            this.names(PatternSymbols.symbolsFromPattern(pattern))
        );
        List<PatternSymbols.Binding> bindings
            = PatternSymbols.bindingsFromPatterns(List.of(pattern));
        assertEquals(Fixtures.at(2, 3), bindings.get(0).region());
        assertEquals(Fixtures.at(13, 14), bindings.get(1).region());
    }

    @Test
    @DisplayName("An unwrapped opaque binds its argument and then itself")
    void opaqueBindings() throws ErrorException {
        Symbol id = new Symbol(
            Fixtures.HOME, this.fx.env.identIds().add("Id")
        );
        this.fx.scope.addOpaque("Id", new OpaqueDef(
            id, Fixtures.at(0, 0), List.of(), List.of(), DataType.emptyRecord()
        ));
        Pattern pattern = this.fx.pattern(PatternType.FUNCTION_ARG, "@Id who");
        List<PatternSymbols.Binding> bindings
            = PatternSymbols.bindingsFromPatterns(List.of(pattern));
        assertEquals(2, bindings.size());
        assertEquals("who", this.fx.nameOf(bindings.get(0).symbol()));
        assertEquals(Fixtures.at(4, 7), bindings.get(0).region());
        assertEquals(id, bindings.get(1).symbol());
        assertEquals(Fixtures.at(0, 7), bindings.get(1).region());
    }

    @Test
    @DisplayName("Specializations yield the member they specialize as well")
    void specializationSymbols() throws ErrorException {
        Symbol ability = this.fx.env.intern("Hash");
        Symbol member = this.fx.scope
            .introduce("hash", Fixtures.at(0, 0)).symbol();
        AbilitiesStore abilities = new AbilitiesStore();
        abilities.registerAbility(ability, List.of(
            new AbilitiesStore.Member(ability, member, Fixtures.at(0, 0))
        ));
        Pattern pattern = this.fx.canonicalizer.canonicalizeDefHeaderPattern(
            abilities, PatternType.TOP_LEVEL_DEF,
            Fixtures.parse("hash"), Fixtures.at(0, 4)
        ).pattern();
        List<Symbol> symbols = PatternSymbols.symbolsFromPattern(pattern);
        assertEquals(2, symbols.size());
        assertEquals(member, symbols.get(1));
        assertEquals(
            1, PatternSymbols.bindingsFromPatterns(List.of(pattern)).size()
        );
    }

    @Test
    @DisplayName("Bindings of several patterns keep the order of the patterns")
    void orderAcrossPatterns() throws ErrorException {
        Pattern first = this.fx.pattern(PatternType.FUNCTION_ARG, "{ b, a }");
        Pattern second = this.fx.pattern(PatternType.FUNCTION_ARG, "c");
        List<PatternSymbols.Binding> bindings
            = PatternSymbols.bindingsFromPatterns(List.of(first, second));
        assertEquals(
            List.of("b", "a", "c"),
            this.names(bindings.stream()
                .map(PatternSymbols.Binding::symbol).toList())
        );
    }

    @Test
    @DisplayName("Literals, wildcards and error sentinels bind nothing")
    void nothingBound() throws ErrorException {
        for(String text: List.of("42", "\"text\"", "_", "'c'", "Foo.bar")) {
            Pattern pattern = this.fx.pattern(PatternType.WHEN_BRANCH, text);
            assertTrue(
                PatternSymbols.symbolsFromPattern(pattern).isEmpty(), text
            );
        }
    }

}
