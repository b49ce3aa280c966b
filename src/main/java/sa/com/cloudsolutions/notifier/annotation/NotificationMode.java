package sa.com.cloudsolutions.notifier.annotation;

/**
 * Decides which properties of a {@link Notifier} class are woven.
 */
public enum NotificationMode {
    /**
     * Only properties carrying {@link Notify} are woven.
     */
    EXPLICIT,
    /**
     * Every property with a public setter is woven unless it carries {@link SuppressNotify}.
     * Properties marked with {@link Notify} keep the names they declare.
     */
    IMPLICIT
}
