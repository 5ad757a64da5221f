package typesafeschwalbe.patcan.can;

import typesafeschwalbe.patcan.compiler.Source;

public record Loc<T>(Source region, T value) {

    public static <T> Loc<T> at(Source region, T value) {
        return new Loc<>(region, value);
    }

    @Override
    public String toString() {
        return String.valueOf(this.value) + this.region;
    }

}
