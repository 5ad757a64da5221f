package typesafeschwalbe.patcan.frontend;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import typesafeschwalbe.patcan.compiler.Error;
import typesafeschwalbe.patcan.compiler.ErrorException;
import typesafeschwalbe.patcan.compiler.Source;

public class PatternParser extends Parser {

    public PatternParser(Lexer lexer) throws ErrorException {
        super(lexer);
    }

    public List<AstPattern> parsePatterns() throws ErrorException {
        List<AstPattern> patterns = new ArrayList<>();
        while(true) {
            while(this.current.type == Token.Type.NEWLINE) {
                this.next();
            }
            if(this.current.type == Token.Type.FILE_END) { break; }
            List<String> before = this.takeTrivia();
            AstPattern pattern = this.parsePattern();
            List<String> after = this.takeTrivia();
            this.expect(Token.Type.NEWLINE, Token.Type.FILE_END);
            if(!after.isEmpty()) {
                pattern = new AstPattern(
                    AstPattern.Type.SPACE_AFTER,
                    new AstPattern.Spaced(pattern, after),
                    pattern.source
                );
            }
            if(!before.isEmpty()) {
                pattern = new AstPattern(
                    AstPattern.Type.SPACE_BEFORE,
                    new AstPattern.Spaced(pattern, before),
                    pattern.source
                );
            }
            patterns.add(pattern);
        }
        return patterns;
    }

    public AstPattern parsePattern() throws ErrorException {
        if(!this.current.type.equals(Token.Type.TAG)
            && !this.current.type.equals(Token.Type.PRIVATE_TAG)
            && !this.current.type.equals(Token.Type.OPAQUE_REF)) {
            return this.parseAtom();
        }
        AstPattern tag = this.parseAtom();
        if(!tag.isTag()) {
            return tag;
        }
        List<AstPattern> arguments = new ArrayList<>();
        while(PatternParser.startsAtom(this.current.type)) {
            arguments.add(this.parseAtom());
        }
        if(arguments.isEmpty()) {
            return tag;
        }
        return new AstPattern(
            AstPattern.Type.APPLY,
            new AstPattern.Apply(tag, arguments),
            new Source(tag.source, arguments.get(arguments.size() - 1).source)
        );
    }

    private static boolean startsAtom(Token.Type type) {
        switch(type) {
            case IDENTIFIER:
            case TAG:
            case PRIVATE_TAG:
            case OPAQUE_REF:
            case DOTTED_IDENTIFIER:
            case UNDERSCORE:
            case INTEGER:
            case FRACTION:
            case BASE_INTEGER:
            case STRING:
            case BLOCK_STRING:
            case CHARACTER:
            case UNTERMINATED:
            case BRACE_OPEN:
            case PAREN_OPEN:
                return true;
            default:
                return false;
        }
    }

    private AstPattern malformedIdent(Token token, BadIdent problem) {
        return new AstPattern(
            AstPattern.Type.MALFORMED_IDENT,
            new AstPattern.MalformedIdent(token.content, problem),
            token.source
        );
    }

    private AstPattern parseSigilTag(
        Token token, AstPattern.Type type, BadIdent problem
    ) {
        String name = token.content.substring(1);
        if(!Lexer.isUppercase(name.charAt(0)) || name.contains(".")) {
            return this.malformedIdent(token, problem);
        }
        return new AstPattern(type, new AstPattern.Name(name), token.source);
    }

    private AstPattern parseDotted(Token token) {
        String[] parts = token.content.split("\\.", -1);
        for(String part: parts) {
            if(part.isEmpty()) {
                return this.malformedIdent(token, BadIdent.STRAY_DOT);
            }
        }
        if(!Lexer.isUppercase(parts[0].charAt(0))) {
            return this.malformedIdent(token, BadIdent.WEIRD_DOT_ACCESS);
        }
        String last = parts[parts.length - 1];
        if(Lexer.isUppercase(last.charAt(0))) {
            return this.malformedIdent(token, BadIdent.QUALIFIED_TAG);
        }
        String moduleName = token.content.substring(
            0, token.content.length() - last.length() - 1
        );
        return new AstPattern(
            AstPattern.Type.QUALIFIED_IDENTIFIER,
            new AstPattern.Qualified(moduleName, last),
            token.source
        );
    }

    private AstPattern parseNonBase10(Token token) {
        boolean isNegative = token.content.startsWith("-");
        String unsigned = isNegative
            ? token.content.substring(1)
            : token.content;
        Base base;
        switch(unsigned.charAt(1)) {
            case 'x': base = Base.HEX; break;
            case 'o': base = Base.OCTAL; break;
            case 'b': base = Base.BINARY; break;
            default:
                throw new IllegalStateException(
                    "lexer produced a base integer without a base prefix"
                );
        }
        return new AstPattern(
            AstPattern.Type.NON_BASE10_LITERAL,
            new AstPattern.NonBase10(unsigned.substring(2), base, isNegative),
            token.source
        );
    }

    private AstPattern parseAtom() throws ErrorException {
        Token token = this.current;
        switch(token.type) {
            case IDENTIFIER: {
                this.next();
                if(token.content.contains("_")) {
                    return this.malformedIdent(token, BadIdent.UNDERSCORE);
                }
                return new AstPattern(
                    AstPattern.Type.IDENTIFIER,
                    new AstPattern.Name(token.content),
                    token.source
                );
            }
            case TAG: {
                this.next();
                return new AstPattern(
                    AstPattern.Type.GLOBAL_TAG,
                    new AstPattern.Name(token.content),
                    token.source
                );
            }
            case PRIVATE_TAG: {
                this.next();
                return this.parseSigilTag(
                    token, AstPattern.Type.PRIVATE_TAG, BadIdent.BAD_PRIVATE_TAG
                );
            }
            case OPAQUE_REF: {
                this.next();
                return this.parseSigilTag(
                    token, AstPattern.Type.OPAQUE_REF, BadIdent.BAD_OPAQUE_REF
                );
            }
            case DOTTED_IDENTIFIER: {
                this.next();
                return this.parseDotted(token);
            }
            case UNDERSCORE: {
                this.next();
                return new AstPattern(
                    AstPattern.Type.UNDERSCORE,
                    new AstPattern.Name(token.content.substring(1)),
                    token.source
                );
            }
            case INTEGER: {
                this.next();
                return new AstPattern(
                    AstPattern.Type.NUM_LITERAL,
                    new AstPattern.Literal(token.content),
                    token.source
                );
            }
            case FRACTION: {
                this.next();
                return new AstPattern(
                    AstPattern.Type.FLOAT_LITERAL,
                    new AstPattern.Literal(token.content),
                    token.source
                );
            }
            case BASE_INTEGER: {
                this.next();
                return this.parseNonBase10(token);
            }
            case STRING:
            case BLOCK_STRING: {
                this.next();
                return new AstPattern(
                    AstPattern.Type.STR_LITERAL,
                    this.parseStrLiteral(token),
                    token.source
                );
            }
            case CHARACTER: {
                this.next();
                return new AstPattern(
                    AstPattern.Type.SINGLE_QUOTE,
                    new AstPattern.Literal(this.parseCharacter(token)),
                    token.source
                );
            }
            case UNTERMINATED: {
                this.next();
                return new AstPattern(
                    AstPattern.Type.MALFORMED,
                    new AstPattern.Literal(token.content),
                    token.source
                );
            }
            case BRACE_OPEN: {
                return this.parseRecordDestructure();
            }
            case PAREN_OPEN: {
                this.nesting += 1;
                this.next();
                AstPattern inner = this.parsePattern();
                this.expect(Token.Type.PAREN_CLOSE);
                this.nesting -= 1;
                this.next();
                return inner;
            }
            default: {
                this.throwUnexpected("a pattern");
                return null;
            }
        }
    }

    private AstPattern parseRecordDestructure() throws ErrorException {
        Source start = this.current.source;
        this.nesting += 1;
        this.next();
        List<AstPattern> fields = new ArrayList<>();
        while(this.current.type != Token.Type.BRACE_CLOSE) {
            this.expect(Token.Type.IDENTIFIER);
            Token label = this.current;
            this.next();
            if(this.current.type == Token.Type.COLON) {
                this.next();
                AstPattern guard = this.parsePattern();
                fields.add(new AstPattern(
                    AstPattern.Type.REQUIRED_FIELD,
                    new AstPattern.RequiredField(label.content, guard),
                    new Source(label.source, guard.source)
                ));
            } else if(this.current.type == Token.Type.QUESTION_MARK) {
                this.next();
                AstExpr defaultValue = this.parseExpr();
                fields.add(new AstPattern(
                    AstPattern.Type.OPTIONAL_FIELD,
                    new AstPattern.OptionalField(label.content, defaultValue),
                    new Source(label.source, defaultValue.source)
                ));
            } else {
                fields.add(new AstPattern(
                    AstPattern.Type.IDENTIFIER,
                    new AstPattern.Name(label.content),
                    label.source
                ));
            }
            if(this.current.type != Token.Type.COMMA) {
                this.expect(Token.Type.BRACE_CLOSE);
                break;
            }
            this.next();
        }
        Source end = this.current.source;
        this.nesting -= 1;
        this.next();
        return new AstPattern(
            AstPattern.Type.RECORD_DESTRUCTURE,
            new AstPattern.Fields(fields),
            new Source(start, end)
        );
    }

    public AstExpr parseExpr() throws ErrorException {
        if(this.current.type != Token.Type.TAG) {
            return this.parseExprAtom();
        }
        Token tag = this.current;
        this.next();
        List<AstExpr> arguments = new ArrayList<>();
        while(PatternParser.startsExprAtom(this.current.type)) {
            arguments.add(this.parseExprAtom());
        }
        Source source = arguments.isEmpty()
            ? tag.source
            : new Source(tag.source, arguments.get(arguments.size() - 1).source);
        return new AstExpr(
            AstExpr.Type.TAG,
            new AstExpr.Tag(tag.content, arguments),
            source
        );
    }

    private static boolean startsExprAtom(Token.Type type) {
        switch(type) {
            case IDENTIFIER:
            case TAG:
            case INTEGER:
            case FRACTION:
            case STRING:
            case BLOCK_STRING:
            case BRACE_OPEN:
            case PAREN_OPEN:
                return true;
            default:
                return false;
        }
    }

    private AstExpr parseExprAtom() throws ErrorException {
        Token token = this.current;
        switch(token.type) {
            case IDENTIFIER: {
                this.next();
                return new AstExpr(
                    AstExpr.Type.VARIABLE_ACCESS,
                    new AstExpr.VariableAccess(token.content),
                    token.source
                );
            }
            case TAG: {
                this.next();
                return new AstExpr(
                    AstExpr.Type.TAG,
                    new AstExpr.Tag(token.content, List.of()),
                    token.source
                );
            }
            case INTEGER: {
                this.next();
                return new AstExpr(
                    AstExpr.Type.NUM_LITERAL,
                    new AstExpr.SimpleLiteral(token.content),
                    token.source
                );
            }
            case FRACTION: {
                this.next();
                return new AstExpr(
                    AstExpr.Type.FLOAT_LITERAL,
                    new AstExpr.SimpleLiteral(token.content),
                    token.source
                );
            }
            case STRING:
            case BLOCK_STRING: {
                this.next();
                return new AstExpr(
                    AstExpr.Type.STR_LITERAL,
                    this.parseStrLiteral(token),
                    token.source
                );
            }
            case BRACE_OPEN: {
                Source start = token.source;
                this.nesting += 1;
                this.next();
                Map<String, AstExpr> fields = new LinkedHashMap<>();
                while(this.current.type != Token.Type.BRACE_CLOSE) {
                    this.expect(Token.Type.IDENTIFIER);
                    String label = this.current.content;
                    this.next();
                    this.expect(Token.Type.COLON);
                    this.next();
                    fields.put(label, this.parseExpr());
                    if(this.current.type != Token.Type.COMMA) {
                        this.expect(Token.Type.BRACE_CLOSE);
                        break;
                    }
                    this.next();
                }
                Source end = this.current.source;
                this.nesting -= 1;
                this.next();
                return new AstExpr(
                    AstExpr.Type.RECORD,
                    new AstExpr.RecordLiteral(fields),
                    new Source(start, end)
                );
            }
            case PAREN_OPEN: {
                this.nesting += 1;
                this.next();
                AstExpr inner = this.parseExpr();
                this.expect(Token.Type.PAREN_CLOSE);
                this.nesting -= 1;
                this.next();
                return inner;
            }
            default: {
                this.throwUnexpected("an expression");
                return null;
            }
        }
    }

    private static Error invalidEscape(Source source, String reason) {
        return new Error(
            "Invalid escape sequence",
            Error.Marking.error(source, reason)
        );
    }

    private static int closingParen(String content, int openPos, int endPos) {
        int depth = 0;
        boolean inString = false;
        for(int pos = openPos; pos < endPos; pos += 1) {
            char c = content.charAt(pos);
            if(c == '\\') {
                pos += 1;
                continue;
            }
            if(c == '"') { inString = !inString; }
            if(inString) { continue; }
            if(c == '(') { depth += 1; }
            if(c == ')') {
                depth -= 1;
                if(depth == 0) { return pos; }
            }
        }
        return -1;
    }

    private List<StrSegment> parseSegments(
        int startPos, int endPos
    ) throws ErrorException {
        String file = this.lexer().fileName();
        String content = this.lexer().fileContent();
        List<StrSegment> segments = new ArrayList<>();
        int textStart = startPos;
        int pos = startPos;
        while(pos < endPos) {
            if(content.charAt(pos) != '\\') {
                pos += 1;
                continue;
            }
            if(textStart < pos) {
                segments.add(new StrSegment(
                    StrSegment.Type.PLAINTEXT,
                    new StrSegment.Plaintext(content.substring(textStart, pos)),
                    new Source(file, textStart, pos)
                ));
            }
            char escaped = pos + 1 < endPos? content.charAt(pos + 1) : '\0';
            if(escaped == '(' || (escaped == 'u'
                    && pos + 2 < endPos && content.charAt(pos + 2) == '(')) {
                int openPos = escaped == '('? pos + 1 : pos + 2;
                int closePos = PatternParser.closingParen(
                    content, openPos, endPos
                );
                Source segmentSource = new Source(
                    file, pos, closePos == -1? endPos : closePos + 1
                );
                if(closePos == -1) {
                    throw new ErrorException(PatternParser.invalidEscape(
                        segmentSource, "this is missing its closing ')'"
                    ));
                }
                if(escaped == '(') {
                    PatternParser inner = new PatternParser(new Lexer(
                        file, content, openPos + 1, closePos
                    ));
                    AstExpr expression = inner.parseExpr();
                    inner.expect(Token.Type.FILE_END);
                    segments.add(new StrSegment(
                        StrSegment.Type.INTERPOLATED,
                        new StrSegment.Interpolated(expression),
                        segmentSource
                    ));
                } else {
                    segments.add(new StrSegment(
                        StrSegment.Type.UNICODE,
                        new StrSegment.Unicode(
                            content.substring(openPos + 1, closePos)
                        ),
                        segmentSource
                    ));
                }
                pos = closePos + 1;
                textStart = pos;
                continue;
            }
            Source segmentSource = new Source(file, pos, pos + 2);
            if(!PatternParser.isEscapable(escaped)) {
                throw new ErrorException(PatternParser.invalidEscape(
                    segmentSource,
                    "'\\" + escaped + "' is not a known escape sequence"
                ));
            }
            segments.add(new StrSegment(
                StrSegment.Type.ESCAPED_CHAR,
                new StrSegment.EscapedChar(escaped),
                segmentSource
            ));
            pos += 2;
            textStart = pos;
        }
        if(textStart < endPos) {
            segments.add(new StrSegment(
                StrSegment.Type.PLAINTEXT,
                new StrSegment.Plaintext(content.substring(textStart, endPos)),
                new Source(file, textStart, endPos)
            ));
        }
        return segments;
    }

    public static boolean isEscapable(char c) {
        switch(c) {
            case '\\':
            case '"':
            case '\'':
            case 'n':
            case 'r':
            case 't':
            case '$':
                return true;
            default:
                return false;
        }
    }

    private StrLiteral parseStrLiteral(Token token) throws ErrorException {
        int start = token.source.startOffset();
        int end = token.source.endOffset();
        if(token.type == Token.Type.BLOCK_STRING) {
            String content = this.lexer().fileContent();
            List<List<StrSegment>> lines = new ArrayList<>();
            int lineStart = start + 3;
            int bodyEnd = end - 3;
            for(int pos = lineStart; pos <= bodyEnd; pos += 1) {
                if(pos < bodyEnd && content.charAt(pos) != '\n') { continue; }
                int lineEnd = pos < bodyEnd? pos + 1 : pos;
                lines.add(this.parseSegments(lineStart, lineEnd));
                lineStart = lineEnd;
            }
            return new StrLiteral(StrLiteral.Kind.BLOCK, lines);
        }
        List<StrSegment> segments = this.parseSegments(start + 1, end - 1);
        boolean plain = true;
        for(StrSegment segment: segments) {
            plain &= segment.type == StrSegment.Type.PLAINTEXT;
        }
        if(plain && segments.size() <= 1) {
            if(segments.isEmpty()) {
                segments = List.of(new StrSegment(
                    StrSegment.Type.PLAINTEXT,
                    new StrSegment.Plaintext(""),
                    new Source(token.source.file(), start + 1, start + 1)
                ));
            }
            return new StrLiteral(StrLiteral.Kind.PLAIN_LINE, List.of(segments));
        }
        return new StrLiteral(StrLiteral.Kind.LINE, List.of(segments));
    }

    private String parseCharacter(Token token) throws ErrorException {
        String file = token.source.file();
        int start = token.source.startOffset() + 1;
        String raw = token.content.substring(1, token.content.length() - 1);
        StringBuilder decoded = new StringBuilder();
        for(int idx = 0; idx < raw.length(); idx += 1) {
            char c = raw.charAt(idx);
            if(c != '\\') {
                decoded.append(c);
                continue;
            }
            char escaped = idx + 1 < raw.length()? raw.charAt(idx + 1) : '\0';
            Source escapeSource = new Source(
                file, start + idx, start + Math.min(idx + 2, raw.length())
            );
            if(escaped == 'u' && idx + 2 < raw.length()
                    && raw.charAt(idx + 2) == '(') {
                int closeIdx = raw.indexOf(')', idx + 3);
                if(closeIdx == -1) {
                    throw new ErrorException(PatternParser.invalidEscape(
                        escapeSource, "this is missing its closing ')'"
                    ));
                }
                String digits = raw.substring(idx + 3, closeIdx);
                int codePoint;
                try {
                    codePoint = Integer.parseInt(digits, 16);
                } catch(NumberFormatException e) {
                    throw new ErrorException(PatternParser.invalidEscape(
                        new Source(file, start + idx, start + closeIdx + 1),
                        "'" + digits + "' is not a hexadecimal code point"
                    ));
                }
                if(!Character.isValidCodePoint(codePoint)) {
                    throw new ErrorException(PatternParser.invalidEscape(
                        new Source(file, start + idx, start + closeIdx + 1),
                        "'" + digits + "' is outside of the unicode range"
                    ));
                }
                decoded.appendCodePoint(codePoint);
                idx = closeIdx;
                continue;
            }
            if(!PatternParser.isEscapable(escaped)) {
                throw new ErrorException(PatternParser.invalidEscape(
                    escapeSource,
                    "'\\" + escaped + "' is not a known escape sequence"
                ));
            }
            decoded.append(PatternParser.unescape(escaped));
            idx += 1;
        }
        return decoded.toString();
    }

    public static char unescape(char escaped) {
        switch(escaped) {
            case 'n': return '\n';
            case 'r': return '\r';
            case 't': return '\t';
            case '\\':
            case '"':
            case '\'':
            case '$':
                return escaped;
            default:
                throw new IllegalArgumentException(
                    "'" + escaped + "' is not an escapable character"
                );
        }
    }

}
