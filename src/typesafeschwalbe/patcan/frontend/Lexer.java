package typesafeschwalbe.patcan.frontend;

import java.util.function.Function;

import typesafeschwalbe.patcan.compiler.Error;
import typesafeschwalbe.patcan.compiler.ErrorException;
import typesafeschwalbe.patcan.compiler.Source;

public class Lexer {

    private final String fileName;
    private final String fileContent;
    private final int endPos;

    private int currentPos;

    public Lexer(String fileName, String fileContent) {
        this(fileName, fileContent, 0, fileContent.length());
    }

    // Lexes only 'fileContent[startPos, endPos)' while still reporting
    // offsets relative to the whole file.
    public Lexer(
        String fileName, String fileContent, int startPos, int endPos
    ) {
        this.fileName = fileName;
        this.fileContent = fileContent;
        this.currentPos = startPos;
        this.endPos = endPos;
    }

    public static boolean isDigit(char c) {
        return '0' <= c && c <= '9';
    }

    public static boolean isLowercase(char c) {
        return 'a' <= c && c <= 'z';
    }

    public static boolean isUppercase(char c) {
        return 'A' <= c && c <= 'Z';
    }

    public static boolean isAlphanumeral(char c) {
        return Lexer.isDigit(c)
            || Lexer.isLowercase(c)
            || Lexer.isUppercase(c)
            || c == '_';
    }

    public static boolean isWhitespace(char c) {
        return c == 9   // horizontal tab
            || c == 32; // space
    }

    public String fileName() {
        return this.fileName;
    }

    public String fileContent() {
        return this.fileContent;
    }

    private char charAt(int pos) {
        if(pos >= this.endPos) { return '\0'; }
        return this.fileContent.charAt(pos);
    }

    private char current() {
        return this.charAt(this.currentPos);
    }

    private char peek() {
        return this.charAt(this.currentPos + 1);
    }

    public boolean atEnd() {
        return this.currentPos >= this.endPos;
    }

    private int find(int from, Function<Character, Boolean> f) {
        int pos = from;
        while(pos < this.endPos) {
            if(f.apply(this.fileContent.charAt(pos))) { break; }
            pos += 1;
        }
        return pos;
    }

    private Token makeToken(int startPos, Token.Type type) {
        return new Token(
            type,
            this.fileContent.substring(startPos, this.currentPos),
            new Source(this.fileName, startPos, this.currentPos)
        );
    }

    private Token lexNumber() {
        int startPos = this.currentPos;
        if(this.current() == '-') { this.currentPos += 1; }
        char prefixChar = this.peek();
        if(this.current() == '0'
            && (prefixChar == 'x' || prefixChar == 'o' || prefixChar == 'b')) {
            this.currentPos = this.find(
                this.currentPos + 2, c -> !Lexer.isAlphanumeral(c)
            );
            return this.makeToken(startPos, Token.Type.BASE_INTEGER);
        }
        boolean isFraction = false;
        this.currentPos = this.find(
            this.currentPos, c -> !Lexer.isDigit(c) && c != '_'
        );
        if(this.current() == '.' && Lexer.isDigit(this.peek())) {
            isFraction = true;
            this.currentPos = this.find(
                this.currentPos + 1, c -> !Lexer.isDigit(c) && c != '_'
            );
        }
        if(this.current() == 'e') {
            int expPos = this.currentPos + 1;
            char sign = this.charAt(expPos);
            if(sign == '-' || sign == '+') { expPos += 1; }
            if(Lexer.isDigit(this.charAt(expPos))) {
                isFraction = true;
                this.currentPos = this.find(expPos, c -> !Lexer.isDigit(c));
            }
        }
        // width suffix such as 'u8' or 'f64'
        this.currentPos = this.find(
            this.currentPos, c -> !Lexer.isAlphanumeral(c)
        );
        return this.makeToken(
            startPos, isFraction? Token.Type.FRACTION : Token.Type.INTEGER
        );
    }

    // Returns the position right after the closing quote, or -1 if the
    // string does not end on this line.
    private int scanLineString(int openQuotePos) {
        int pos = openQuotePos + 1;
        int interpolationDepth = 0;
        while(pos < this.endPos) {
            char c = this.fileContent.charAt(pos);
            if(c == '\n' || c == '\r') { return -1; }
            if(interpolationDepth > 0) {
                if(c == '(') { interpolationDepth += 1; }
                if(c == ')') { interpolationDepth -= 1; }
                if(c == '"') {
                    int nestedEnd = this.scanLineString(pos);
                    if(nestedEnd == -1) { return -1; }
                    pos = nestedEnd;
                    continue;
                }
                pos += 1;
                continue;
            }
            if(c == '\\') {
                if(this.charAt(pos + 1) == '(') {
                    interpolationDepth = 1;
                }
                pos += 2;
                continue;
            }
            if(c == '"') { return pos + 1; }
            pos += 1;
        }
        return -1;
    }

    private Token lexString() {
        int startPos = this.currentPos;
        boolean isBlock = this.charAt(startPos + 1) == '"'
            && this.charAt(startPos + 2) == '"';
        if(isBlock) {
            int endIdx = this.fileContent.indexOf("\"\"\"", startPos + 3);
            if(endIdx == -1 || endIdx + 3 > this.endPos) {
                this.currentPos = this.endPos;
                return this.makeToken(startPos, Token.Type.UNTERMINATED);
            }
            this.currentPos = endIdx + 3;
            return this.makeToken(startPos, Token.Type.BLOCK_STRING);
        }
        int endIdx = this.scanLineString(startPos);
        if(endIdx == -1) {
            this.currentPos = this.find(
                startPos, c -> c == '\n' || c == '\r'
            );
            return this.makeToken(startPos, Token.Type.UNTERMINATED);
        }
        this.currentPos = endIdx;
        return this.makeToken(startPos, Token.Type.STRING);
    }

    private Token lexCharacter() {
        int startPos = this.currentPos;
        int pos = startPos + 1;
        while(pos < this.endPos) {
            char c = this.fileContent.charAt(pos);
            if(c == '\n' || c == '\r') { break; }
            if(c == '\\') {
                pos += 2;
                continue;
            }
            if(c == '\'') {
                this.currentPos = pos + 1;
                return this.makeToken(startPos, Token.Type.CHARACTER);
            }
            pos += 1;
        }
        this.currentPos = Math.min(pos, this.endPos);
        return this.makeToken(startPos, Token.Type.UNTERMINATED);
    }

    private Token lexName() {
        int startPos = this.currentPos;
        char first = this.current();
        int nameStart = (first == '$' || first == '@')
            ? startPos + 1
            : startPos;
        this.currentPos = this.find(nameStart, c -> !Lexer.isAlphanumeral(c));
        boolean dotted = false;
        while(this.current() == '.') {
            dotted = true;
            this.currentPos = this.find(
                this.currentPos + 1, c -> !Lexer.isAlphanumeral(c)
            );
        }
        if(first == '$') {
            return this.makeToken(startPos, Token.Type.PRIVATE_TAG);
        }
        if(first == '@') {
            return this.makeToken(startPos, Token.Type.OPAQUE_REF);
        }
        if(dotted) {
            return this.makeToken(startPos, Token.Type.DOTTED_IDENTIFIER);
        }
        if(first == '_') {
            return this.makeToken(startPos, Token.Type.UNDERSCORE);
        }
        return this.makeToken(
            startPos,
            Lexer.isUppercase(first)? Token.Type.TAG : Token.Type.IDENTIFIER
        );
    }

    public Token nextToken() throws ErrorException {
        if(this.atEnd()) {
            return new Token(
                Token.Type.FILE_END, "",
                new Source(this.fileName, this.endPos, this.endPos)
            );
        }
        int startPos = this.currentPos;
        char c = this.current();
        if(c == '\n' || c == '\r') {
            this.currentPos += (c == '\r' && this.peek() == '\n')? 2 : 1;
            return this.makeToken(startPos, Token.Type.NEWLINE);
        }
        if(Lexer.isWhitespace(c)) {
            this.currentPos = this.find(
                startPos, ch -> !Lexer.isWhitespace(ch)
            );
            return this.makeToken(startPos, Token.Type.WHITESPACE);
        }
        if(c == '#') {
            this.currentPos = this.find(
                startPos, ch -> ch == '\n' || ch == '\r'
            );
            return this.makeToken(startPos, Token.Type.COMMENT);
        }
        if(Lexer.isDigit(c) || (c == '-' && Lexer.isDigit(this.peek()))) {
            return this.lexNumber();
        }
        if(c == '"') {
            return this.lexString();
        }
        if(c == '\'') {
            return this.lexCharacter();
        }
        if(Lexer.isAlphanumeral(c)
            || ((c == '$' || c == '@') && Lexer.isAlphanumeral(this.peek()))) {
            return this.lexName();
        }
        this.currentPos += 1;
        switch(c) {
            case ',': return this.makeToken(startPos, Token.Type.COMMA);
            case ':': return this.makeToken(startPos, Token.Type.COLON);
            case '?': return this.makeToken(startPos, Token.Type.QUESTION_MARK);
            case '(': return this.makeToken(startPos, Token.Type.PAREN_OPEN);
            case ')': return this.makeToken(startPos, Token.Type.PAREN_CLOSE);
            case '{': return this.makeToken(startPos, Token.Type.BRACE_OPEN);
            case '}': return this.makeToken(startPos, Token.Type.BRACE_CLOSE);
            default: break;
        }
        throw new ErrorException(new Error(
            "Unrecognized character",
            Error.Marking.error(
                new Source(this.fileName, startPos, startPos + 1),
                "'" + c + "' can not appear in a pattern"
            )
        ));
    }

}
