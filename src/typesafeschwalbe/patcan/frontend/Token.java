package typesafeschwalbe.patcan.frontend;

import typesafeschwalbe.patcan.compiler.Source;

public class Token {

    public enum Type {
        WHITESPACE("a whitespace"),
        NEWLINE("a line break"),
        COMMENT("a line comment"),
        FILE_END("the end of the file"),

        IDENTIFIER("an identifier"),
        TAG("a tag"),
        PRIVATE_TAG("a private tag"),
        OPAQUE_REF("an opaque reference"),
        DOTTED_IDENTIFIER("a qualified name"),
        UNDERSCORE("'_'"),
        INTEGER("an integer"),
        FRACTION("a fractional number"),
        BASE_INTEGER("an integer with a base prefix"),
        STRING("a string"),
        BLOCK_STRING("a block string"),
        CHARACTER("a character literal"),
        UNTERMINATED("an unterminated literal"),
        COMMA("','"),
        COLON("':'"),
        QUESTION_MARK("'?'"),
        PAREN_OPEN("'('"),
        PAREN_CLOSE("')'"),
        BRACE_OPEN("'{'"),
        BRACE_CLOSE("'}'");

        public final String description;

        private Type(String description) {
            this.description = description;
        }

        public boolean isTrivia() {
            return this == WHITESPACE || this == COMMENT;
        }
    }

    public final Type type;
    public final String content;
    public final Source source;

    Token(Type type, String content, Source source) {
        this.type = type;
        this.content = content;
        this.source = source;
    }

    @Override
    public String toString() {
        StringBuilder output = new StringBuilder();
        output.append("[");
        output.append(this.type);
        output.append(" - '");
        output.append(this.content);
        output.append("']");
        return output.toString();
    }

}
