package typesafeschwalbe.patcan.compiler;

public record Symbol(Namespace module, int identId) {

    @Override
    public String toString() {
        return this.module.toString() + "#" + this.identId;
    }

}
