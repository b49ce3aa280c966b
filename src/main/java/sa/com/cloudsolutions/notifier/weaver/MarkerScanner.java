package sa.com.cloudsolutions.notifier.weaver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sa.com.cloudsolutions.notifier.annotation.NotificationMode;
import sa.com.cloudsolutions.notifier.annotation.Notifier;
import sa.com.cloudsolutions.notifier.annotation.SuppressNotify;
import sa.com.cloudsolutions.notifier.model.Marker;
import sa.com.cloudsolutions.notifier.model.PropertyModel;
import sa.com.cloudsolutions.notifier.model.TypeModel;

import java.util.List;
import java.util.Optional;

/**
 * Walks a class and its nested classes, weaving every property of a {@link Notifier} class that asks for it.
 */
public class MarkerScanner {
    private static final Logger logger = LoggerFactory.getLogger(MarkerScanner.class);

    private final NotifyTargetResolver targetResolver;
    private final PropertyNameResolver nameResolver;
    private final SetterRewriter rewriter;

    public MarkerScanner(NotifyTargetResolver targetResolver) {
        this(targetResolver, new PropertyNameResolver(), new SetterRewriter());
    }

    public MarkerScanner(NotifyTargetResolver targetResolver, PropertyNameResolver nameResolver,
                         SetterRewriter rewriter) {
        this.targetResolver = targetResolver;
        this.nameResolver = nameResolver;
        this.rewriter = rewriter;
    }

    /**
     * Weaves {@code type}, then its nested classes. Each class that had a setter rewritten is marked modified.
     *
     * @return whether a setter of {@code type} itself was rewritten; nested classes do not count
     * @throws WeavingException on the first declaration that cannot be woven
     */
    public boolean processType(TypeModel type) {
        boolean altered = false;

        Optional<Marker> notifier = type.markers().find(Notifier.class);
        if (notifier.isPresent()) {
            NotificationMode mode = modeOf(notifier.get());
            ResolvedNotifyTarget target = targetResolver.resolve(type).orElseThrow(
                    () -> new WeavingException("Cannot locate notify target for type: " + type.name()));

            for (PropertyModel property : type.properties()) {
                if (property.hasMarker(SuppressNotify.class)) {
                    continue;
                }
                List<String> names = nameResolver.resolve(property);
                if (names.isEmpty() && mode == NotificationMode.IMPLICIT && property.isSetterPublic()) {
                    names = List.of(property.name());
                }
                if (!names.isEmpty() && weave(type, property, target, names)) {
                    altered = true;
                }
            }
            if (altered) {
                type.markModified();
            }
        }

        for (TypeModel nested : type.nestedTypes()) {
            processType(nested);
        }
        return altered;
    }

    private boolean weave(TypeModel type, PropertyModel property, ResolvedNotifyTarget target, List<String> names) {
        if (!property.hasSetter()) {
            logger.debug("Skipping read-only property {}.{}", type.name(), property.name());
            return false;
        }
        if (property.isSetterBodyless()) {
            throw new WeavingException("Notify cannot be applied to property " + type.name() + "." + property.name()
                    + " because its setter is abstract or native");
        }
        if (!target.isInherited() && property.setter().name.equals(target.name())
                && property.setter().desc.equals(target.descriptor())) {
            // the target itself looks like a setter; weaving it would recurse forever
            logger.debug("Skipping {}.{}, its setter is the notify target", type.name(), property.name());
            return false;
        }
        rewriter.rewrite(property.setter(), target, names);
        logger.debug("Wove {}.{} -> {} with {}", type.name(), property.setter().name, target.qualifiedName(), names);
        return true;
    }

    private static NotificationMode modeOf(Marker notifier) {
        Object mode = notifier.argument("mode");
        return mode == null ? NotificationMode.EXPLICIT : NotificationMode.valueOf((String) mode);
    }
}
