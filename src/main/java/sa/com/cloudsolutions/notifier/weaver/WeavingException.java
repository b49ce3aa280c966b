package sa.com.cloudsolutions.notifier.weaver;

/**
 * A declaration that cannot be woven. Aborts the whole run before anything is written.
 */
public class WeavingException extends RuntimeException {
    public WeavingException(String message) {
        super(message);
    }
}
