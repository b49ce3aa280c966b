package sa.com.cloudsolutions.notifier.model;

import org.objectweb.asm.Type;
import org.objectweb.asm.tree.AnnotationNode;

import java.lang.annotation.Annotation;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One annotation found in a class file, with the arguments that were written explicitly.
 *
 * Defaults declared by the annotation type are not recorded in class files, so an argument that was
 * left out reports {@code hasArgument(name) == false}. Argument values keep the shapes ASM uses, with two
 * conversions: arrays become {@link List}s and enum constants become their constant name.
 */
public final class Marker {
    private final String descriptor;
    private final Map<String, Object> arguments;

    private Marker(String descriptor, Map<String, Object> arguments) {
        this.descriptor = descriptor;
        this.arguments = Collections.unmodifiableMap(arguments);
    }

    public static Marker of(AnnotationNode node) {
        Map<String, Object> args = new LinkedHashMap<>();
        if (node.values != null) {
            for (int i = 0; i + 1 < node.values.size(); i += 2) {
                args.put((String) node.values.get(i), convert(node.values.get(i + 1)));
            }
        }
        return new Marker(node.desc, args);
    }

    /**
     * Builds a marker directly. {@code arguments} may map a name to {@code null}, which class files cannot express.
     */
    public static Marker of(Class<? extends Annotation> type, Map<String, Object> arguments) {
        return new Marker(Type.getDescriptor(type), new LinkedHashMap<>(arguments));
    }

    public static Marker of(Class<? extends Annotation> type) {
        return of(type, Map.of());
    }

    private static Object convert(Object value) {
        if (value instanceof String[] && ((String[]) value).length == 2) {
            // enum constant: {descriptor, name}
            return ((String[]) value)[1];
        }
        if (value instanceof List) {
            List<Object> converted = new ArrayList<>();
            for (Object element : (List<?>) value) {
                converted.add(convert(element));
            }
            return converted;
        }
        if (value instanceof AnnotationNode) {
            return of((AnnotationNode) value);
        }
        return value;
    }

    public String descriptor() {
        return descriptor;
    }

    public boolean is(Class<? extends Annotation> type) {
        return descriptor.equals(Type.getDescriptor(type));
    }

    public boolean hasArguments() {
        return !arguments.isEmpty();
    }

    public boolean hasArgument(String name) {
        return arguments.containsKey(name);
    }

    public Object argument(String name) {
        return arguments.get(name);
    }

    @Override
    public String toString() {
        return "@" + Type.getType(descriptor).getClassName() + arguments;
    }
}
