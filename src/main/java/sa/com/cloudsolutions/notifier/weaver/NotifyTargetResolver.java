package sa.com.cloudsolutions.notifier.weaver;

import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;
import org.objectweb.asm.tree.MethodNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sa.com.cloudsolutions.notifier.annotation.NotifyTarget;
import sa.com.cloudsolutions.notifier.model.TypeModel;
import sa.com.cloudsolutions.notifier.model.TypeResolver;

import java.util.Optional;

/**
 * Finds the {@link NotifyTarget} method of a notifier class, walking up the super class chain. The nearest
 * declaration wins; nothing is merged across levels.
 */
public class NotifyTargetResolver {
    private static final Logger logger = LoggerFactory.getLogger(NotifyTargetResolver.class);
    private static final String OBJECT = "java/lang/Object";
    private static final Type STRING = Type.getType(String.class);

    private final TypeResolver typeResolver;

    public NotifyTargetResolver(TypeResolver typeResolver) {
        this.typeResolver = typeResolver;
    }

    /**
     * @return the target, callable from {@code type}, or empty when no class up to the root declares one
     * @throws WeavingException if a marked method has the wrong shape, or a super class cannot be resolved
     */
    public Optional<ResolvedNotifyTarget> resolve(TypeModel type) {
        for (MethodNode method : type.methods()) {
            if (TypeModel.markers(method).has(NotifyTarget.class)) {
                validate(type, method);
                ResolvedNotifyTarget target = ResolvedNotifyTarget.declaredBy(type, method);
                logger.debug("Notify target of {} is {}", type.name(), target);
                return Optional.of(target);
            }
        }

        String superName = type.superName();
        if (superName == null || OBJECT.equals(superName)) {
            return Optional.empty();
        }
        TypeModel base = typeResolver.resolve(superName).orElseThrow(() -> new WeavingException(
                "Cannot resolve base type " + Type.getObjectType(superName).getClassName() + " of " + type.name()));

        return resolve(base).map(target -> target.importInto(type));
    }

    private static void validate(TypeModel type, MethodNode method) {
        Type[] parameters = Type.getArgumentTypes(method.desc);
        boolean isStatic = (method.access & Opcodes.ACC_STATIC) != 0;
        if (isStatic || parameters.length != 1 || !STRING.equals(parameters[0])) {
            throw new WeavingException("Notify target " + type.name() + "." + method.name
                    + " is not a Consumer<String>");
        }
    }
}
