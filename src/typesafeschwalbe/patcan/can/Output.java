package typesafeschwalbe.patcan.can;

import java.util.HashSet;
import java.util.Set;

import typesafeschwalbe.patcan.compiler.Symbol;

// What canonicalizing a node found out about the symbols it touches.
// Outputs of child nodes are merged into their parent with
// 'union', so the order of merging never matters.
public class Output {

    public static class References {

        public final Set<Symbol> boundSymbols;
        public final Set<Symbol> valueLookups;
        public final Set<Symbol> referencedTypeDefs;
        public final Set<Symbol> typeLookups;

        public References() {
            this.boundSymbols = new HashSet<>();
            this.valueLookups = new HashSet<>();
            this.referencedTypeDefs = new HashSet<>();
            this.typeLookups = new HashSet<>();
        }

        void addAll(References other) {
            this.boundSymbols.addAll(other.boundSymbols);
            this.valueLookups.addAll(other.valueLookups);
            this.referencedTypeDefs.addAll(other.referencedTypeDefs);
            this.typeLookups.addAll(other.typeLookups);
        }

        @Override
        public boolean equals(Object otherRaw) {
            if(!(otherRaw instanceof References)) { return false; }
            References other = (References) otherRaw;
            return this.boundSymbols.equals(other.boundSymbols)
                && this.valueLookups.equals(other.valueLookups)
                && this.referencedTypeDefs.equals(other.referencedTypeDefs)
                && this.typeLookups.equals(other.typeLookups);
        }

        @Override
        public int hashCode() {
            return this.boundSymbols.hashCode()
                + 31 * this.valueLookups.hashCode()
                + 961 * this.referencedTypeDefs.hashCode()
                + 29791 * this.typeLookups.hashCode();
        }

        @Override
        public String toString() {
            return "bound=" + this.boundSymbols
                + " values=" + this.valueLookups
                + " typeDefs=" + this.referencedTypeDefs
                + " types=" + this.typeLookups;
        }

    }

    public final References references;

    public Output() {
        this.references = new References();
    }

    public Output union(Output other) {
        this.references.addAll(other.references);
        return this;
    }

    public Output copy() {
        return new Output().union(this);
    }

    @Override
    public boolean equals(Object otherRaw) {
        if(!(otherRaw instanceof Output)) { return false; }
        return this.references.equals(((Output) otherRaw).references);
    }

    @Override
    public int hashCode() {
        return this.references.hashCode();
    }

    @Override
    public String toString() {
        return "Output(" + this.references + ")";
    }

}
