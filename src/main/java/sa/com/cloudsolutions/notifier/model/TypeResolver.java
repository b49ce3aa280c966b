package sa.com.cloudsolutions.notifier.model;

import java.util.Optional;

/**
 * Produces the definition of a class referenced by internal name, which may live outside the module being woven.
 */
@FunctionalInterface
public interface TypeResolver {
    /**
     * @param internalName JVM internal name, e.g. {@code com/example/Base}
     * @return the definition, or empty if no search location has it
     */
    Optional<TypeModel> resolve(String internalName);

    /**
     * Consults {@code fallback} for names this resolver cannot find.
     */
    default TypeResolver orElse(TypeResolver fallback) {
        return internalName -> {
            Optional<TypeModel> found = resolve(internalName);
            return found.isPresent() ? found : fallback.resolve(internalName);
        };
    }
}
