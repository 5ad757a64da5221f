package typesafeschwalbe.patcan.frontend;

import java.util.ArrayList;
import java.util.List;

import typesafeschwalbe.patcan.compiler.Error;
import typesafeschwalbe.patcan.compiler.ErrorException;

public abstract class Parser {

    private final Lexer lexer;
    protected Token current;
    protected final List<String> trivia;
    protected int nesting;

    public Parser(Lexer lexer) throws ErrorException {
        this.lexer = lexer;
        this.trivia = new ArrayList<>();
        this.nesting = 0;
        this.next();
    }

    protected Lexer lexer() {
        return this.lexer;
    }

    protected void throwUnexpected(String expected) throws ErrorException {
        throw new ErrorException(new Error(
            "Unexpected syntax",
            Error.Marking.error(
                this.current.source,
                "expected " + expected + ", but " + (
                    this.current.type == Token.Type.FILE_END
                        ? "reached the end of the file"
                        : "got " + this.current.type.description + " instead"
                )
            )
        ));
    }

    // Advances to the next significant token. Comments are collected as
    // trivia and line breaks only count outside of braces and parentheses.
    protected void next() throws ErrorException {
        while(true) {
            this.current = this.lexer.nextToken();
            if(this.current.type == Token.Type.COMMENT) {
                this.trivia.add(this.current.content);
                continue;
            }
            if(this.current.type.isTrivia()) {
                continue;
            }
            if(this.current.type == Token.Type.NEWLINE && this.nesting > 0) {
                continue;
            }
            break;
        }
    }

    protected List<String> takeTrivia() {
        List<String> taken = List.copyOf(this.trivia);
        this.trivia.clear();
        return taken;
    }

    protected void expect(Token.Type... allowedTypes) throws ErrorException {
        if(!List.of(allowedTypes).contains(this.current.type)) {
            StringBuilder expected = new StringBuilder();
            for(int expIdx = 0; expIdx < allowedTypes.length; expIdx += 1) {
                if(expIdx > 0) { expected.append(
                    expIdx < allowedTypes.length - 1? ", " : " or "
                ); }
                expected.append(allowedTypes[expIdx].description);
            }
            this.throwUnexpected(expected.toString());
        }
    }

}
