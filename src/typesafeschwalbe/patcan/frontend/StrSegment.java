package typesafeschwalbe.patcan.frontend;

import typesafeschwalbe.patcan.compiler.Source;

public class StrSegment {

    public static record Plaintext(String text) {}

    public static record EscapedChar(char escaped) {}

    public static record Unicode(String hexDigits) {}

    public static record Interpolated(AstExpr expression) {}

    public enum Type {
        PLAINTEXT,    // Plaintext
        ESCAPED_CHAR, // EscapedChar
        UNICODE,      // Unicode
        INTERPOLATED  // Interpolated
    }

    public final Type type;
    private final Object value;
    public final Source source;

    public StrSegment(Type type, Object value, Source source) {
        this.type = type;
        this.value = value;
        this.source = source;
    }

    @SuppressWarnings("unchecked")
    public <T> T getValue() {
        return (T) this.value;
    }

    @Override
    public String toString() {
        return this.type + "(" + this.value + ")";
    }

}
