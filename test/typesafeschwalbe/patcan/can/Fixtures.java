package typesafeschwalbe.patcan.can;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;

import typesafeschwalbe.patcan.compiler.ErrorException;
import typesafeschwalbe.patcan.compiler.Namespace;
import typesafeschwalbe.patcan.compiler.Source;
import typesafeschwalbe.patcan.compiler.Symbol;
import typesafeschwalbe.patcan.frontend.AstPattern;
import typesafeschwalbe.patcan.frontend.Lexer;
import typesafeschwalbe.patcan.frontend.PatternParser;
import typesafeschwalbe.patcan.frontend.PatternType;
import typesafeschwalbe.patcan.types.VarStore;

// one canonicalization run over patterns written in a single test file
class Fixtures {

    static final String FILE = "test.pat";
    static final Namespace HOME = Namespace.parse("Test");

    final Env env;
    final VarStore varStore;
    final Scope scope;
    final PatternCanonicalizer canonicalizer;

    Fixtures() {
        this.env = new Env(HOME);
        this.varStore = new VarStore();
        this.scope = new Scope(this.env);
        this.canonicalizer = new PatternCanonicalizer(
            this.env, this.varStore, this.scope
        );
    }

    static AstPattern parse(String text) throws ErrorException {
        List<AstPattern> patterns = new PatternParser(new Lexer(FILE, text))
            .parsePatterns();
        assertEquals(1, patterns.size(), "expected exactly one pattern");
        return patterns.get(0);
    }

    static Source at(int start, int end) {
        return new Source(FILE, start, end);
    }

    PatternCanonicalizer.Canonicalized canonicalize(
        PatternType patternType, String text
    ) throws ErrorException {
        return this.canonicalizer.canonicalizePattern(
            patternType, Fixtures.parse(text)
        );
    }

    Pattern pattern(PatternType patternType, String text)
            throws ErrorException {
        return this.canonicalize(patternType, text).pattern();
    }

    String nameOf(Symbol symbol) {
        return this.env.interns.nameOf(symbol);
    }

}
