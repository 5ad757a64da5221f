package typesafeschwalbe.patcan.frontend;

public enum BadIdent {
    STRAY_DOT("a dot that is not followed by a name"),
    WEIRD_DOT_ACCESS("a field access, which is not a pattern"),
    UNDERSCORE("an identifier containing an underscore after its start"),
    QUALIFIED_TAG("a tag qualified with a module name"),
    BAD_PRIVATE_TAG("a private tag without an uppercase name"),
    BAD_OPAQUE_REF("an opaque reference without an uppercase name");

    public final String description;

    private BadIdent(String description) {
        this.description = description;
    }
}
