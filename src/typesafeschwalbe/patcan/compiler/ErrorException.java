package typesafeschwalbe.patcan.compiler;

public class ErrorException extends Exception {

    public final Error error;

    public ErrorException(Error error) {
        super(error.message());
        this.error = error;
    }

}
