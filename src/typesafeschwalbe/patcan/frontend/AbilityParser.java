package typesafeschwalbe.patcan.frontend;

import java.util.ArrayList;
import java.util.List;

import typesafeschwalbe.patcan.compiler.ErrorException;
import typesafeschwalbe.patcan.compiler.Source;

// Ability files declare one ability per line:
//     Hash: hash, hashWith
public class AbilityParser extends Parser {

    public static record Member(String name, Source source) {}

    public static record Declaration(
        String name, Source source, List<Member> members
    ) {}

    public AbilityParser(Lexer lexer) throws ErrorException {
        super(lexer);
    }

    public List<Declaration> parseDeclarations() throws ErrorException {
        List<Declaration> declarations = new ArrayList<>();
        while(true) {
            while(this.current.type == Token.Type.NEWLINE) {
                this.next();
            }
            if(this.current.type == Token.Type.FILE_END) { break; }
            declarations.add(this.parseDeclaration());
            this.expect(Token.Type.NEWLINE, Token.Type.FILE_END);
        }
        this.takeTrivia();
        return declarations;
    }

    private Declaration parseDeclaration() throws ErrorException {
        this.expect(Token.Type.TAG);
        Token name = this.current;
        this.next();
        this.expect(Token.Type.COLON);
        this.next();
        List<Member> members = new ArrayList<>();
        while(true) {
            this.expect(Token.Type.IDENTIFIER);
            members.add(new Member(this.current.content, this.current.source));
            this.next();
            if(this.current.type != Token.Type.COMMA) { break; }
            this.next();
        }
        return new Declaration(
            name.content, name.source, List.copyOf(members)
        );
    }

}
