package typesafeschwalbe.patcan.compiler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import typesafeschwalbe.patcan.can.Pattern;
import typesafeschwalbe.patcan.can.PatternSymbols;
import typesafeschwalbe.patcan.can.Problem;
import typesafeschwalbe.patcan.frontend.PatternType;

public class CompilerTest {

    private static final Namespace HOME = Namespace.parse("Main");

    private static Compiler.Output canonicalize(
        PatternType patternType, Map<String, String> files
    ) {
        Result<Compiler.Output> result = Compiler.canonicalize(
            files, patternType, CompilerTest.HOME
        );
        assertTrue(result.isValue(), () -> "errors: " + (
            result.isError()? result.getError().toString() : ""
        ));
        return result.getValue();
    }

    @Test
    @DisplayName("Only pattern files are accepted")
    void unsupportedExtension() {
        Result<Compiler.Output> result = Compiler.canonicalize(
            Map.of("notes.txt", "x"), PatternType.WHEN_BRANCH, HOME
        );
        assertTrue(result.isError());
        assertTrue(result.getError().get(0).message().contains("notes.txt"));
    }

    @Test
    @DisplayName("Files that can not be parsed fail the whole run")
    void parseFailure() {
        Result<Compiler.Output> result = Compiler.canonicalize(
            Map.of("good.pat", "x", "bad.pat", "{ a b }"),
            PatternType.WHEN_BRANCH, HOME
        );
        assertTrue(result.isError());
        assertEquals("Unexpected syntax", result.getError().get(0).message());
    }

    @Test
    @DisplayName("All files share one scope, in file name order")
    void sharedScope() {
        Compiler.Output output = CompilerTest.canonicalize(
            PatternType.FUNCTION_ARG,
            Map.of("b.pat", "x", "a.pat", "x")
        );
        assertEquals(Pattern.Type.IDENTIFIER, output.patterns().get(0).type);
        assertEquals("a.pat", output.patterns().get(0).source.file());
        assertEquals(Pattern.Type.SHADOWED, output.patterns().get(1).type);
        assertEquals(1, output.problems().size());
        Problem.Shadowing shadowing = output.problems().get(0).getValue();
        assertEquals(new Source("a.pat", 0, 1), shadowing.originalRegion());
        assertEquals(new Source("b.pat", 0, 1), shadowing.shadow().region());
    }

    @Test
    @DisplayName("Bindings and variables of all patterns are reported")
    void bindingsAndVariables() {
        Compiler.Output output = CompilerTest.canonicalize(
            PatternType.FUNCTION_ARG,
            Map.of("main.pat", "Foo a b\n{ c }")
        );
        List<String> names = output.bindings().stream()
            .map(PatternSymbols.Binding::symbol)
            .map(output.interns()::nameOf)
            .toList();
        assertEquals(List.of("a", "b", "c"), names);
        assertEquals(7, output.variableCount());
        assertTrue(output.problems().isEmpty());
    }

    @Test
    @DisplayName("Literals are only accepted where the pattern type allows them")
    void literalsDependOnPatternType() {
        Map<String, String> files = Map.of("main.pat", "42\n\"text\"");
        assertTrue(
            CompilerTest.canonicalize(PatternType.WHEN_BRANCH, files)
                .problems().isEmpty()
        );
        Compiler.Output def = CompilerTest.canonicalize(
            PatternType.TOP_LEVEL_DEF, files
        );
        assertEquals(2, def.problems().size());
        for(Problem problem: def.problems()) {
            assertEquals(Problem.Type.UNSUPPORTED_PATTERN, problem.type);
        }
        List<Error> errors = def.problemErrors();
        assertEquals("Unsupported pattern", errors.get(0).message());
        assertTrue(
            errors.get(1).render(files, false).contains("a top-level definition")
        );
    }

    @Test
    @DisplayName("Definitions named like declared ability members specialize them")
    void abilityFilesEnableSpecialization() {
        Map<String, String> files = Map.of(
            "hash.abilities", "Hash: hash, eq\n",
            "main.pat", "hash\neq\nhash\nx"
        );
        Compiler.Output output = CompilerTest.canonicalize(
            PatternType.TOP_LEVEL_DEF, files
        );
        List<Pattern.Type> types = output.patterns().stream()
            .map(pattern -> pattern.type)
            .toList();
        assertEquals(
            List.of(
                Pattern.Type.ABILITY_MEMBER_SPECIALIZATION,
                Pattern.Type.ABILITY_MEMBER_SPECIALIZATION,
                Pattern.Type.ABILITY_MEMBER_SPECIALIZATION,
                Pattern.Type.IDENTIFIER
            ),
            types
        );
        Pattern.AbilityMemberSpecialization first = output.patterns().get(0)
            .getValue();
        Pattern.AbilityMemberSpecialization again = output.patterns().get(2)
            .getValue();
        assertEquals(first.specializes(), again.specializes());
        assertEquals("hash", output.interns().nameOf(first.specializes()));
        assertTrue(output.problems().isEmpty());

        Compiler.Output args = CompilerTest.canonicalize(
            PatternType.FUNCTION_ARG, files
        );
        assertEquals(Pattern.Type.SHADOWED, args.patterns().get(0).type);
        Problem.Shadowing shadowing = args.problems().get(0).getValue();
        assertEquals(
            new Source("hash.abilities", 6, 10), shadowing.originalRegion()
        );
        assertTrue(
            args.problemErrors().get(0).render(files, false)
                .contains("hash.abilities")
        );
    }

    @Test
    @DisplayName("Abilities and their members can only be declared once")
    void duplicateDeclarations() {
        Result<Compiler.Output> result = Compiler.canonicalize(
            Map.of(
                "a.abilities", "Hash: hash\nEq: isEq",
                "b.abilities", "Hash: other\nOrd: isEq",
                "main.pat", "x"
            ),
            PatternType.TOP_LEVEL_DEF, HOME
        );
        assertTrue(result.isError());
        List<String> messages = result.getError().stream()
            .map(Error::message)
            .toList();
        assertEquals(
            List.of("Duplicate ability", "Duplicate ability member"), messages
        );
    }

    @Test
    @DisplayName("Malformed ability files fail the whole run")
    void malformedAbilityFile() {
        Result<Compiler.Output> result = Compiler.canonicalize(
            Map.of("a.abilities", "hash: Hash", "main.pat", "x"),
            PatternType.TOP_LEVEL_DEF, HOME
        );
        assertTrue(result.isError());
        assertEquals("Unexpected syntax", result.getError().get(0).message());
    }

}
