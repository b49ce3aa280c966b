package sa.com.cloudsolutions.notifier.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Opts a class into setter weaving.
 *
 * The class, or one of its super classes, must declare exactly one method marked with
 * {@link NotifyTarget}. After weaving, every qualifying setter calls that method once per
 * property name it reports.
 */
@Documented
@Retention(RetentionPolicy.CLASS)
@Target(ElementType.TYPE)
public @interface Notifier {
    NotificationMode mode() default NotificationMode.EXPLICIT;
}
