package typesafeschwalbe.patcan.types;

public record LambdaSet(DataType type) {

    @Override
    public String toString() {
        return "[[" + this.type + "]]";
    }

}
