package typesafeschwalbe.patcan.frontend;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import typesafeschwalbe.patcan.compiler.ErrorException;
import typesafeschwalbe.patcan.compiler.Source;

public class PatternParserTest {

    private static List<AstPattern> parse(String text) throws ErrorException {
        return new PatternParser(new Lexer("test.pat", text)).parsePatterns();
    }

    private static AstPattern parseOne(String text) throws ErrorException {
        List<AstPattern> patterns = PatternParserTest.parse(text);
        assertEquals(1, patterns.size());
        return patterns.get(0);
    }

    private static Source at(int start, int end) {
        return new Source("test.pat", start, end);
    }

    @Test
    @DisplayName("Tags take the atoms that follow them as arguments")
    void application() throws ErrorException {
        AstPattern pattern = PatternParserTest.parseOne("Foo a (Bar b) 1");
        assertEquals(AstPattern.Type.APPLY, pattern.type);
        assertEquals(PatternParserTest.at(0, 15), pattern.source);
        AstPattern.Apply apply = pattern.getValue();
        assertEquals("Foo", apply.tag().<AstPattern.Name>getValue().name());
        assertEquals(3, apply.arguments().size());
        AstPattern nested = apply.arguments().get(1);
        assertEquals(AstPattern.Type.APPLY, nested.type);
        assertEquals(PatternParserTest.at(7, 12), nested.source);
        assertEquals(
            AstPattern.Type.NUM_LITERAL, apply.arguments().get(2).type
        );
    }

    @Test
    @DisplayName("Each line holds one pattern, except inside braces")
    void lines() throws ErrorException {
        List<AstPattern> patterns = PatternParserTest.parse(
            "\n{ a,\n  b: x }\n\nc\n"
        );
        assertEquals(2, patterns.size());
        assertEquals(AstPattern.Type.RECORD_DESTRUCTURE, patterns.get(0).type);
        assertEquals(AstPattern.Type.IDENTIFIER, patterns.get(1).type);
        assertTrue(PatternParserTest.parse("# nothing here\n\n").isEmpty());
    }

    @Test
    @DisplayName("Record fields may be plain, guarded or optional")
    void recordFields() throws ErrorException {
        AstPattern pattern = PatternParserTest.parseOne(
            "{ a, b: Just c, d ? Foo 1 }"
        );
        List<AstPattern> fields = pattern
            .<AstPattern.Fields>getValue().fields();
        assertEquals(
            List.of(
                AstPattern.Type.IDENTIFIER, AstPattern.Type.REQUIRED_FIELD,
                AstPattern.Type.OPTIONAL_FIELD
            ),
            fields.stream().map(f -> f.type).toList()
        );
        AstPattern.RequiredField guarded = fields.get(1).getValue();
        assertEquals("b", guarded.label());
        assertEquals(AstPattern.Type.APPLY, guarded.guard().type);
        assertEquals(PatternParserTest.at(5, 14), fields.get(1).source);
        AstPattern.OptionalField optional = fields.get(2).getValue();
        assertEquals(AstExpr.Type.TAG, optional.defaultValue().type);
    }

    @Test
    @DisplayName("Unusable names become malformed identifiers")
    void malformedIdents() throws ErrorException {
        String[] texts = { "snake_case", "$lower", "@lower", "a..b", "A.B", "x.y" };
        BadIdent[] expected = {
            BadIdent.UNDERSCORE, BadIdent.BAD_PRIVATE_TAG,
            BadIdent.BAD_OPAQUE_REF, BadIdent.STRAY_DOT,
            BadIdent.QUALIFIED_TAG, BadIdent.WEIRD_DOT_ACCESS
        };
        for(int idx = 0; idx < texts.length; idx += 1) {
            AstPattern pattern = PatternParserTest.parseOne(texts[idx]);
            assertEquals(AstPattern.Type.MALFORMED_IDENT, pattern.type, texts[idx]);
            assertEquals(
                expected[idx],
                pattern.<AstPattern.MalformedIdent>getValue().problem()
            );
        }
        AstPattern.Qualified qualified = PatternParserTest
            .parseOne("Json.Decode.field").getValue();
        assertEquals("Json.Decode", qualified.moduleName());
        assertEquals("field", qualified.ident());
    }

    @Test
    @DisplayName("Based integers keep their digits and sign apart")
    void basedIntegers() throws ErrorException {
        AstPattern.NonBase10 literal = PatternParserTest
            .parseOne("-0x1F").getValue();
        assertEquals("1F", literal.digits());
        assertEquals(Base.HEX, literal.base());
        assertTrue(literal.isNegative());
    }

    @Test
    @DisplayName("Strings are split into segments")
    void strings() throws ErrorException {
        StrLiteral plain = PatternParserTest.parseOne("\"x\"").getValue();
        assertEquals(StrLiteral.Kind.PLAIN_LINE, plain.kind());

        StrLiteral escaped = PatternParserTest.parseOne("\"a\\nb\"").getValue();
        assertEquals(StrLiteral.Kind.LINE, escaped.kind());
        assertEquals(
            List.of(
                StrSegment.Type.PLAINTEXT, StrSegment.Type.ESCAPED_CHAR,
                StrSegment.Type.PLAINTEXT
            ),
            escaped.lines().get(0).stream().map(s -> s.type).toList()
        );

        StrLiteral block = PatternParserTest
            .parseOne("\"\"\"one\ntwo\"\"\"").getValue();
        assertEquals(StrLiteral.Kind.BLOCK, block.kind());
        assertEquals(2, block.lines().size());

        StrLiteral empty = PatternParserTest.parseOne("\"\"").getValue();
        assertEquals(
            "",
            empty.lines().get(0).get(0).<StrSegment.Plaintext>getValue().text()
        );
    }

    @Test
    @DisplayName("Character literals are decoded")
    void characters() throws ErrorException {
        assertEquals(
            "A",
            PatternParserTest.parseOne("'\\u(41)'")
                .<AstPattern.Literal>getValue().text()
        );
        assertEquals(
            "\t",
            PatternParserTest.parseOne("'\\t'")
                .<AstPattern.Literal>getValue().text()
        );
    }

    @Test
    @DisplayName("Comments are kept around the pattern they belong to")
    void comments() throws ErrorException {
        AstPattern pattern = PatternParserTest.parseOne("# before\nx # after");
        assertEquals(AstPattern.Type.SPACE_BEFORE, pattern.type);
        AstPattern.Spaced before = pattern.getValue();
        assertEquals(List.of("# before"), before.trivia());
        assertEquals(AstPattern.Type.SPACE_AFTER, before.inner().type);
        AstPattern.Spaced after = before.inner().getValue();
        assertEquals(List.of("# after"), after.trivia());
    }

    @Test
    @DisplayName("Syntax errors abort parsing")
    void syntaxErrors() {
        for(String text: List.of("{ a b }", "x y", "(Foo", "{ a: }", ",")) {
            ErrorException e = assertThrows(
                ErrorException.class, () -> PatternParserTest.parse(text), text
            );
            assertEquals("Unexpected syntax", e.error.message());
        }
        ErrorException escape = assertThrows(
            ErrorException.class, () -> PatternParserTest.parse("\"\\q\"")
        );
        assertEquals("Invalid escape sequence", escape.error.message());
    }

}
