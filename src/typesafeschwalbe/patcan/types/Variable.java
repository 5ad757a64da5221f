package typesafeschwalbe.patcan.types;

public class Variable {

    public final int id;

    Variable(int id) {
        this.id = id;
    }

    @Override
    public String toString() {
        return "$" + this.id;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(this.id);
    }

    @Override
    public boolean equals(Object otherRaw) {
        if(!(otherRaw instanceof Variable)) {
            return false;
        }
        Variable other = (Variable) otherRaw;
        return this.id == other.id;
    }

}
