package sa.com.cloudsolutions.notifier.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Requests change notification for a property. May be placed on the setter, the getter or the
 * backing field.
 *
 * <ul>
 *   <li>{@code @Notify} or {@code @Notify({})} reports the property's own name.</li>
 *   <li>{@code @Notify({"total", "average"})} reports each name in order, once per name.</li>
 *   <li>{@code @Notify(unnamed = true)} reports a single {@code null} name, which listeners such
 *       as {@link java.beans.PropertyChangeSupport} treat as "unspecified property".</li>
 * </ul>
 */
@Documented
@Retention(RetentionPolicy.CLASS)
@Target({ElementType.METHOD, ElementType.FIELD})
public @interface Notify {
    String[] value() default {};

    boolean unnamed() default false;
}
