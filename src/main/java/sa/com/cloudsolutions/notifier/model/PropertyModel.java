package sa.com.cloudsolutions.notifier.model;

import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.FieldNode;
import org.objectweb.asm.tree.MethodNode;

import java.lang.annotation.Annotation;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A JavaBean property of a class: the backing field, getter and setter that share one name, any of which may
 * be missing.
 */
public final class PropertyModel {
    private final String name;
    private final FieldNode field;
    private final MethodNode getter;
    private final MethodNode setter;
    private final Markers markers;

    public PropertyModel(String name, FieldNode field, MethodNode getter, MethodNode setter, Markers markers) {
        this.name = name;
        this.field = field;
        this.getter = getter;
        this.setter = setter;
        this.markers = markers;
    }

    /**
     * Collects markers from the setter, then the field, then the getter. Lookups return the first match, so a
     * marker on the setter takes precedence over the same marker elsewhere.
     */
    static PropertyModel of(String name, FieldNode field, MethodNode getter, MethodNode setter) {
        List<Marker> merged = new ArrayList<>();
        if (setter != null) {
            merged.addAll(Markers.of(setter.visibleAnnotations, setter.invisibleAnnotations).all());
        }
        if (field != null) {
            merged.addAll(Markers.of(field.visibleAnnotations, field.invisibleAnnotations).all());
        }
        if (getter != null) {
            merged.addAll(Markers.of(getter.visibleAnnotations, getter.invisibleAnnotations).all());
        }
        return new PropertyModel(name, field, getter, setter, Markers.of(merged.toArray(new Marker[0])));
    }

    public String name() {
        return name;
    }

    public FieldNode field() {
        return field;
    }

    public MethodNode getter() {
        return getter;
    }

    public MethodNode setter() {
        return setter;
    }

    public Markers markers() {
        return markers;
    }

    public Optional<Marker> marker(Class<? extends Annotation> type) {
        return markers.find(type);
    }

    public boolean hasMarker(Class<? extends Annotation> type) {
        return markers.has(type);
    }

    public boolean hasSetter() {
        return setter != null;
    }

    public boolean isSetterPublic() {
        return setter != null && (setter.access & Opcodes.ACC_PUBLIC) != 0;
    }

    /**
     * True for abstract and native setters, which have no instructions to rewrite.
     */
    public boolean isSetterBodyless() {
        return setter != null && (setter.access & (Opcodes.ACC_ABSTRACT | Opcodes.ACC_NATIVE)) != 0;
    }

    @Override
    public String toString() {
        return "Property[" + name + "]";
    }
}
