package sa.com.cloudsolutions.notifier.model;

import org.objectweb.asm.ClassReader;
import org.objectweb.asm.ClassWriter;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;
import org.objectweb.asm.tree.ClassNode;
import org.objectweb.asm.tree.FieldNode;
import org.objectweb.asm.tree.InnerClassNode;
import org.objectweb.asm.tree.MethodNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A class file loaded into an editable ASM tree, together with the nested classes found next to it.
 */
public final class TypeModel {
    private final ClassNode node;
    private final byte[] original;
    private final Markers markers;
    private final List<TypeModel> nestedTypes = new ArrayList<>();
    private List<PropertyModel> properties;
    private boolean modified;

    TypeModel(ClassNode node, byte[] original) {
        this.node = node;
        this.original = original;
        this.markers = Markers.of(node.visibleAnnotations, node.invisibleAnnotations);
    }

    /**
     * Parses a class file.
     *
     * @param bytes   the class file contents
     * @param options {@link ClassReader} parsing options, e.g. {@link ClassReader#SKIP_DEBUG}
     */
    public static TypeModel read(byte[] bytes, int options) {
        ClassReader reader = new ClassReader(bytes);
        ClassNode node = new ClassNode();
        reader.accept(node, options);
        return new TypeModel(node, bytes);
    }

    public ClassNode node() {
        return node;
    }

    /**
     * JVM internal name, e.g. {@code com/example/Person$Address}.
     */
    public String internalName() {
        return node.name;
    }

    /**
     * Binary name, e.g. {@code com.example.Person$Address}.
     */
    public String name() {
        return Type.getObjectType(node.name).getClassName();
    }

    /**
     * Internal name of the super class, or {@code null} for {@code java.lang.Object} and module descriptors.
     */
    public String superName() {
        return node.superName;
    }

    public boolean isInterface() {
        return (node.access & Opcodes.ACC_INTERFACE) != 0;
    }

    public Markers markers() {
        return markers;
    }

    public List<MethodNode> methods() {
        return node.methods;
    }

    public static Markers markers(MethodNode method) {
        return Markers.of(method.visibleAnnotations, method.invisibleAnnotations);
    }

    /**
     * Internal name of the class this one is nested in, taken from its own {@code InnerClasses} entry or, for
     * local and anonymous classes, from its {@code EnclosingMethod} attribute. {@code null} for top level classes.
     */
    public String outerName() {
        for (InnerClassNode inner : node.innerClasses) {
            if (inner.name.equals(node.name)) {
                return inner.outerName != null ? inner.outerName : node.outerClass;
            }
        }
        return null;
    }

    /**
     * Internal name of the host of this class's nest: the {@code NestHost} attribute, or the class itself.
     */
    public String nestHost() {
        return node.nestHostClass != null ? node.nestHostClass : node.name;
    }

    public List<TypeModel> nestedTypes() {
        return Collections.unmodifiableList(nestedTypes);
    }

    void addNestedType(TypeModel nested) {
        nestedTypes.add(nested);
    }

    /**
     * JavaBean properties in declaration order: instance fields first, then accessors whose property has no
     * field of the same name.
     */
    public List<PropertyModel> properties() {
        if (properties == null) {
            properties = discoverProperties();
        }
        return properties;
    }

    private List<PropertyModel> discoverProperties() {
        Map<String, FieldNode> fields = new LinkedHashMap<>();
        Map<String, MethodNode> getters = new LinkedHashMap<>();
        Map<String, MethodNode> setters = new LinkedHashMap<>();
        List<String> order = new ArrayList<>();

        for (FieldNode field : node.fields) {
            if ((field.access & (Opcodes.ACC_STATIC | Opcodes.ACC_SYNTHETIC)) == 0) {
                fields.put(field.name, field);
                order.add(field.name);
            }
        }
        for (MethodNode method : node.methods) {
            if ((method.access & (Opcodes.ACC_STATIC | Opcodes.ACC_SYNTHETIC | Opcodes.ACC_BRIDGE)) != 0) {
                continue;
            }
            Type type = Type.getMethodType(method.desc);
            int arity = type.getArgumentTypes().length;
            Type returns = type.getReturnType();
            String property;
            if (arity == 1 && (property = accessorProperty(method.name, "set")) != null) {
                FieldNode field = fields.get(property);
                MethodNode existing = setters.get(property);
                // overloaded setters: keep the one whose parameter matches the field
                if (existing == null || (field != null && type.getArgumentTypes()[0].getDescriptor().equals(field.desc))) {
                    setters.put(property, method);
                }
            } else if (arity == 0 && returns.getSort() != Type.VOID
                    && (property = accessorProperty(method.name, "get")) != null) {
                getters.putIfAbsent(property, method);
            } else if (arity == 0 && returns.getSort() == Type.BOOLEAN
                    && (property = accessorProperty(method.name, "is")) != null) {
                getters.putIfAbsent(property, method);
            } else {
                continue;
            }
            if (!order.contains(property)) {
                order.add(property);
            }
        }

        List<PropertyModel> found = new ArrayList<>();
        for (String property : order) {
            found.add(PropertyModel.of(property, fields.get(property), getters.get(property), setters.get(property)));
        }
        return Collections.unmodifiableList(found);
    }

    private static String accessorProperty(String methodName, String prefix) {
        if (methodName.length() <= prefix.length() || !methodName.startsWith(prefix)) {
            return null;
        }
        String suffix = methodName.substring(prefix.length());
        if (Character.isLowerCase(suffix.charAt(0))) {
            return null;
        }
        return decapitalize(suffix);
    }

    /**
     * Same rule as {@code java.beans.Introspector.decapitalize}: {@code Name -> name}, {@code URL -> URL}.
     */
    static String decapitalize(String name) {
        if (name.length() > 1 && Character.isUpperCase(name.charAt(1)) && Character.isUpperCase(name.charAt(0))) {
            return name;
        }
        return Character.toLowerCase(name.charAt(0)) + name.substring(1);
    }

    public void markModified() {
        modified = true;
    }

    public boolean isModified() {
        return modified;
    }

    /**
     * The class file as it was read.
     */
    public byte[] originalBytes() {
        return original;
    }

    /**
     * Serializes the current tree. Max stack and locals are recomputed; existing stack map frames are kept,
     * which stays valid as long as rewrites insert straight-line code only.
     */
    public byte[] toByteArray() {
        ClassWriter writer = new ClassWriter(ClassWriter.COMPUTE_MAXS);
        node.accept(writer);
        return writer.toByteArray();
    }

    @Override
    public String toString() {
        return name();
    }
}
