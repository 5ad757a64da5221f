package typesafeschwalbe.patcan.frontend;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import typesafeschwalbe.patcan.compiler.ErrorException;
import typesafeschwalbe.patcan.compiler.Source;

public class AbilityParserTest {

    private static List<AbilityParser.Declaration> parse(String text)
            throws ErrorException {
        return new AbilityParser(new Lexer("test.abilities", text))
            .parseDeclarations();
    }

    @Test
    @DisplayName("Each line declares an ability and its members")
    void declarations() throws ErrorException {
        List<AbilityParser.Declaration> declarations = AbilityParserTest.parse(
            "# equality\nEq: isEq\n\nHash: hash, hashWith\n"
        );
        assertEquals(2, declarations.size());
        AbilityParser.Declaration eq = declarations.get(0);
        assertEquals("Eq", eq.name());
        assertEquals(new Source("test.abilities", 11, 13), eq.source());
        assertEquals(
            List.of(new AbilityParser.Member(
                "isEq", new Source("test.abilities", 15, 19)
            )),
            eq.members()
        );
        assertEquals(
            List.of("hash", "hashWith"),
            declarations.get(1).members().stream()
                .map(AbilityParser.Member::name)
                .toList()
        );
        assertTrue(AbilityParserTest.parse("\n# nothing\n").isEmpty());
    }

    @Test
    @DisplayName("Declarations need a tag, a colon and named members")
    void syntaxErrors() {
        for(String text: List.of("eq: isEq", "Eq isEq", "Eq:", "Eq: isEq,", "Eq: Foo")) {
            ErrorException e = assertThrows(
                ErrorException.class, () -> AbilityParserTest.parse(text), text
            );
            assertEquals("Unexpected syntax", e.error.message());
        }
    }

}
