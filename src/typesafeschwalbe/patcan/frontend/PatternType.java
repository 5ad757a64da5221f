package typesafeschwalbe.patcan.frontend;

public enum PatternType {
    TOP_LEVEL_DEF("a top-level definition"),
    DEF_EXPR("a definition"),
    FUNCTION_ARG("a function argument"),
    WHEN_BRANCH("a when branch");

    public final String description;

    private PatternType(String description) {
        this.description = description;
    }
}
