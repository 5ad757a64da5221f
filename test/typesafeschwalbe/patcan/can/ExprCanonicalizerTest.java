package typesafeschwalbe.patcan.can;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.OptionalInt;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import typesafeschwalbe.patcan.compiler.ErrorException;
import typesafeschwalbe.patcan.compiler.Symbol;
import typesafeschwalbe.patcan.frontend.Lexer;
import typesafeschwalbe.patcan.frontend.PatternParser;

public class ExprCanonicalizerTest {

    private Fixtures fx;
    private ExprCanonicalizer canonicalizer;

    @BeforeEach
    void setup() {
        this.fx = new Fixtures();
        this.canonicalizer = new ExprCanonicalizer(
            this.fx.env, this.fx.varStore, this.fx.scope
        );
    }

    private ExprCanonicalizer.Canonicalized canonicalize(String text)
            throws ErrorException {
        return this.canonicalizer.canonicalize(
            new PatternParser(new Lexer(Fixtures.FILE, text)).parseExpr()
        );
    }

    @Test
    @DisplayName("Tag arguments get their variable after being canonicalized")
    void tagVariables() throws ErrorException {
        Symbol x = this.fx.scope.introduce("x", Fixtures.at(0, 0)).symbol();
        ExprCanonicalizer.Canonicalized result = this.canonicalize("Pair 1 x");
        assertEquals(Expr.Type.TAG, result.expr().type);
        Expr.Tag tag = result.expr().getValue();
        assertEquals("Pair", tag.name());
        Expr.NumLiteral one = tag.arguments().get(0).expr().getValue();
        assertEquals(0, one.variable().id);
        assertEquals(1, tag.arguments().get(0).variable().id);
        assertEquals(2, tag.arguments().get(1).variable().id);
        assertEquals(3, tag.variantVar().id);
        assertEquals(4, tag.extVar().id);
        assertEquals(Set.of(x), result.output().references.valueLookups);
    }

    @Test
    @DisplayName("Record fields are keyed by label and minted in source order")
    void recordFields() throws ErrorException {
        ExprCanonicalizer.Canonicalized result = this.canonicalize(
            "{ b: 1, a: 2.5 }"
        );
        assertEquals(Expr.Type.RECORD, result.expr().type);
        Expr.RecordLiteral record = result.expr().getValue();
        assertEquals(List.of("a", "b"), List.copyOf(record.fields().keySet()));
        assertEquals(1, record.fields().get("b").variable().id);
        assertEquals(4, record.fields().get("a").variable().id);
        Expr.FloatLiteral a = record.fields().get("a").expr().getValue();
        assertEquals(2.5, a.value());
        assertEquals(5, record.recordVar().id);
    }

    @Test
    @DisplayName("Unknown names become runtime errors")
    void unknownName() throws ErrorException {
        this.fx.scope.introduce("known", Fixtures.at(0, 0));
        Expr expr = this.canonicalize("unknown").expr();
        assertEquals(Expr.Type.RUNTIME_ERROR, expr.type);
        Problem problem = expr.<Expr.RuntimeError>getValue().problem();
        assertEquals(Problem.Type.LOOKUP_NOT_IN_SCOPE, problem.type);
        assertEquals(
            Set.of("known"),
            problem.<Problem.LookupNotInScope>getValue().namesInScope()
        );
        assertEquals(List.of(problem), this.fx.env.problems());
    }

    @Test
    @DisplayName("Malformed numbers become runtime errors")
    void malformedNumber() throws ErrorException {
        Expr expr = this.canonicalize("300u8").expr();
        assertEquals(Expr.Type.RUNTIME_ERROR, expr.type);
        Problem.MalformedPattern problem = expr.<Expr.RuntimeError>getValue()
            .problem().getValue();
        assertEquals(
            MalformedPatternProblem.Kind.MALFORMED_INT, problem.problem().kind()
        );
    }

    @Test
    @DisplayName("Interpolated strings keep their text and expressions apart")
    void interpolation() throws ErrorException {
        Symbol name = this.fx.scope.introduce("name", Fixtures.at(0, 0))
            .symbol();
        ExprCanonicalizer.Canonicalized result = this.canonicalize(
            "\"hi \\(name)!\""
        );
        assertEquals(Expr.Type.STR_INTERPOLATION, result.expr().type);
        List<Expr> segments = result.expr()
            .<Expr.StrInterpolation>getValue().segments();
        assertEquals(3, segments.size());
        assertEquals("hi ", segments.get(0).<Expr.Str>getValue().text());
        assertEquals(name, segments.get(1).<Expr.Var>getValue().symbol());
        assertEquals("!", segments.get(2).<Expr.Str>getValue().text());
        assertEquals(Set.of(name), result.output().references.valueLookups);
    }

    @Test
    @DisplayName("Strings without interpolation are flattened")
    void plainString() throws ErrorException {
        Expr expr = this.canonicalize("\"tab\\there\"").expr();
        assertEquals(Expr.Type.STR, expr.type);
        assertEquals("tab\there", expr.<Expr.Str>getValue().text());
        assertTrue(this.fx.env.problems().isEmpty());
    }

    @Test
    @DisplayName("Unicode escapes must name a scalar value")
    void unicodeEscapes() {
        assertEquals(OptionalInt.of(0x41), ExprCanonicalizer.decodeUnicode("41"));
        assertEquals(
            OptionalInt.of(0x10FFFF), ExprCanonicalizer.decodeUnicode("10FFFF")
        );
        for(String invalid: List.of("", "D800", "110000", "1234567", "zz")) {
            assertTrue(
                ExprCanonicalizer.decodeUnicode(invalid).isEmpty(), invalid
            );
        }
    }

}
