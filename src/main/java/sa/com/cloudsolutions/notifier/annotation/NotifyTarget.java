package sa.com.cloudsolutions.notifier.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks the instance method that woven setters call with the changed property's name.
 * The method must take exactly one {@link String} parameter. Any return value is discarded.
 */
@Documented
@Retention(RetentionPolicy.CLASS)
@Target(ElementType.METHOD)
public @interface NotifyTarget {
}
