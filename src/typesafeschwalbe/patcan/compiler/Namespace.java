package typesafeschwalbe.patcan.compiler;

import java.util.List;

public record Namespace(List<String> elements) {

    public Namespace {
        if(elements.isEmpty()) {
            throw new IllegalArgumentException(
                "A namespace needs at least one element!"
            );
        }
        elements = List.copyOf(elements);
    }

    public static Namespace parse(String raw) {
        return new Namespace(List.of(raw.split("::")));
    }

    @Override
    public String toString() {
        return String.join("::", this.elements);
    }

}
