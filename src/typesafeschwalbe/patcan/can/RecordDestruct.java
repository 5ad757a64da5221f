package typesafeschwalbe.patcan.can;

import java.util.Objects;

import typesafeschwalbe.patcan.compiler.Source;
import typesafeschwalbe.patcan.compiler.Symbol;
import typesafeschwalbe.patcan.types.Variable;

// One field of a canonical record destructure. For a 'GUARD' field the
// symbol is never bound; only the symbols of the guard pattern are.
public record RecordDestruct(
    Variable variable,
    String label,
    Symbol symbol,
    Kind kind,
    Source source
) {

    public static record Default(Variable defaultVar, Expr defaultValue) {}

    public static record Guard(Variable guardVar, Pattern guard) {}

    public static class Kind {

        public enum Type {
            REQUIRED, // = null
            OPTIONAL, // Default
            GUARD     // Guard
        }

        public final Type type;
        private final Object value;

        private Kind(Type type, Object value) {
            this.type = type;
            this.value = value;
        }

        public static final Kind REQUIRED = new Kind(Type.REQUIRED, null);

        public static Kind optional(Variable defaultVar, Expr defaultValue) {
            return new Kind(
                Type.OPTIONAL, new Default(defaultVar, defaultValue)
            );
        }

        public static Kind guard(Variable guardVar, Pattern guard) {
            return new Kind(Type.GUARD, new Guard(guardVar, guard));
        }

        @SuppressWarnings("unchecked")
        public <T> T getValue() {
            return (T) this.value;
        }

        @Override
        public boolean equals(Object otherRaw) {
            if(!(otherRaw instanceof Kind)) { return false; }
            Kind other = (Kind) otherRaw;
            return this.type == other.type
                && Objects.equals(this.value, other.value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(this.type, this.value);
        }

        @Override
        public String toString() {
            if(this.value == null) {
                return this.type.toString();
            }
            return this.type + "(" + this.value + ")";
        }

    }

}
