package typesafeschwalbe.patcan.frontend;

public enum Base {
    OCTAL(8, "0o"),
    BINARY(2, "0b"),
    HEX(16, "0x"),
    DECIMAL(10, "");

    public final int radix;
    public final String prefix;

    private Base(int radix, String prefix) {
        this.radix = radix;
        this.prefix = prefix;
    }

    @Override
    public String toString() {
        switch(this) {
            case OCTAL: return "octal";
            case BINARY: return "binary";
            case HEX: return "hexadecimal";
            case DECIMAL: return "decimal";
            default:
                throw new RuntimeException("unhandled base!");
        }
    }
}
