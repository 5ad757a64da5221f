package typesafeschwalbe.patcan.frontend;

import java.util.List;

public record StrLiteral(Kind kind, List<List<StrSegment>> lines) {

    public enum Kind {
        PLAIN_LINE,
        LINE,
        BLOCK
    }

    public StrLiteral {
        lines = lines.stream().map(List::copyOf).toList();
        if(kind != Kind.BLOCK && lines.size() != 1) {
            throw new IllegalArgumentException(
                "Only block strings may span more than one line!"
            );
        }
    }

}
