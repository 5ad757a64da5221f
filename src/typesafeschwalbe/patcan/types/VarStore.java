package typesafeschwalbe.patcan.types;

public class VarStore {

    private int nextVarId;

    public VarStore() {
        this.nextVarId = 0;
    }

    public VarStore(int firstId) {
        if(firstId < 0) {
            throw new IllegalArgumentException(
                "Variable ids may not be negative!"
            );
        }
        this.nextVarId = firstId;
    }

    public Variable fresh() {
        int id = this.nextVarId;
        this.nextVarId += 1;
        return new Variable(id);
    }

    public int count() {
        return this.nextVarId;
    }

    @Override
    public String toString() {
        return "VarStore[next=" + this.nextVarId + "]";
    }

}
