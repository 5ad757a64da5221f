package typesafeschwalbe.patcan.compiler;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public record Error(
    String message,
    Marking[] markings,
    Optional<String> hint
) {

    private static final String RED = "31";
    private static final String GREEN = "32";
    private static final String GRAY = "90";
    private static final String BRIGHT_BLUE = "94";
    private static final String BOLD = "1";

    private static String color(String... properties) {
        return "\033[0"
            + (properties.length > 0? ";" : "")
            + String.join(";", properties)
            + "m";
    }

    public static record Marking(Type type, Source location, String note) {

        public enum Type {
            ERROR('^', RED),
            INFO('~', BRIGHT_BLUE);

            private final char marker;
            private final String color;

            private Type(char marker, String color) {
                this.marker = marker;
                this.color = color;
            }
        }

        public static Marking error(Source location, String note) {
            return new Marking(Type.ERROR, location, note);
        }

        public static Marking info(Source location, String note) {
            return new Marking(Type.INFO, location, note);
        }

    }

    public Error(String message, Marking... markings) {
        this(message, markings, Optional.empty());
    }

    public Error(String message, String hint, Marking... markings) {
        this(message, markings, Optional.of(hint));
    }

    @Override
    public boolean equals(Object otherRaw) {
        if(!(otherRaw instanceof Error)) { return false; }
        Error other = (Error) otherRaw;
        return this.message.equals(other.message)
            && Arrays.equals(this.markings, other.markings)
            && this.hint.equals(other.hint);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
            this.message, Arrays.hashCode(this.markings), this.hint
        );
    }

    @Override
    public String toString() {
        return "Error[" + this.message + ", "
            + Arrays.toString(this.markings) + "]";
    }

    private static List<int[]> lineSpans(String content) {
        List<int[]> spans = new ArrayList<>();
        int lineStart = 0;
        for(int charIdx = 0; charIdx < content.length(); charIdx += 1) {
            char c = content.charAt(charIdx);
            if(c != '\n' && c != '\r') { continue; }
            spans.add(new int[] { lineStart, charIdx });
            if(c == '\r'
                && charIdx + 1 < content.length()
                && content.charAt(charIdx + 1) == '\n') {
                charIdx += 1;
            }
            lineStart = charIdx + 1;
        }
        spans.add(new int[] { lineStart, content.length() });
        return spans;
    }

    private static int lineOf(List<int[]> spans, int offset) {
        for(int lineIdx = 0; lineIdx < spans.size(); lineIdx += 1) {
            if(offset <= spans.get(lineIdx)[1]) { return lineIdx; }
        }
        return spans.size() - 1;
    }

    private static void renderMarking(
        StringBuilder output, Marking marked, String content, boolean colored
    ) {
        String gray = colored? Error.color(GRAY) : "";
        String plain = colored? Error.color() : "";
        String markingColor = colored? Error.color(marked.type.color) : "";
        List<int[]> spans = Error.lineSpans(content);
        int startLine = Error.lineOf(spans, marked.location.startOffset());
        int endLine = Error.lineOf(
            spans, Math.max(
                marked.location.startOffset(), marked.location.endOffset() - 1
            )
        );
        final int paddingLines = 1;
        int firstLine = Math.max(0, startLine - paddingLines);
        int lastLine = Math.min(spans.size() - 1, endLine + paddingLines);
        int numberWidth = String.valueOf(lastLine + 1).length();
        final int paddingSpaces = 2;
        String gutter = " ".repeat(paddingSpaces + numberWidth);
        output.append(gutter);
        output.append(gray);
        output.append("╭─ ");
        output.append(marked.location.file());
        output.append(":");
        output.append(startLine + 1);
        output.append(":");
        output.append(
            marked.location.startOffset() - spans.get(startLine)[0] + 1
        );
        output.append("\n");
        for(int lineIdx = firstLine; lineIdx <= lastLine; lineIdx += 1) {
            int[] span = spans.get(lineIdx);
            boolean isMarked = lineIdx >= startLine && lineIdx <= endLine;
            String lineStr = String.valueOf(lineIdx + 1);
            output.append(isMarked? plain : gray);
            output.append(" ".repeat(
                paddingSpaces - 1 + numberWidth - lineStr.length()
            ));
            output.append(lineStr);
            output.append(gray);
            output.append(" │ ");
            output.append(isMarked? plain : gray);
            output.append(content, span[0], span[1]);
            output.append("\n");
            if(!isMarked) { continue; }
            StringBuilder markers = new StringBuilder();
            for(int charIdx = span[0]; charIdx < span[1]; charIdx += 1) {
                boolean inside = charIdx >= marked.location.startOffset()
                    && charIdx < marked.location.endOffset();
                markers.append(inside? marked.type.marker : ' ');
            }
            if(marked.location.length() == 0 && lineIdx == startLine) {
                markers.append(" ".repeat(Math.max(
                    0, marked.location.startOffset() - span[0] - markers.length()
                )));
                markers.append(marked.type.marker);
            }
            output.append(gray);
            output.append(gutter);
            output.append("┊ ");
            output.append(markingColor);
            output.append(markers.toString().stripTrailing());
            if(lineIdx == endLine) {
                output.append(" ");
                output.append(marked.note);
            }
            output.append("\n");
        }
        output.append(gray);
        output.append(" ".repeat(paddingSpaces + numberWidth - 1));
        output.append("─╯\n");
    }

    public String render(Map<String, String> files, boolean colored) {
        StringBuilder output = new StringBuilder();
        output.append(colored? Error.color(BOLD, RED) : "");
        output.append("error: ");
        output.append(colored? Error.color(RED) : "");
        output.append(this.message);
        output.append("\n");
        for(Marking marked: this.markings) {
            String content = files.get(marked.location.file());
            if(content == null) {
                throw new IllegalArgumentException(
                    "An error source location refers to a file"
                        + " that is not present in the provided files!"
                );
            }
            Error.renderMarking(output, marked, content, colored);
        }
        if(this.hint.isPresent()) {
            output.append(colored? Error.color(GREEN) : "");
            output.append("hint: ");
            output.append(this.hint.get());
            output.append("\n");
        }
        if(colored) {
            output.append(Error.color());
        }
        return output.toString();
    }

}
