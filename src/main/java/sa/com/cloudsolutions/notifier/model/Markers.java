package sa.com.cloudsolutions.notifier.model;

import org.objectweb.asm.tree.AnnotationNode;

import java.lang.annotation.Annotation;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The annotations attached to a single class, method or field, both runtime-visible and class-retained.
 */
public final class Markers {
    public static final Markers NONE = new Markers(List.of());

    private final List<Marker> markers;

    private Markers(List<Marker> markers) {
        this.markers = Collections.unmodifiableList(markers);
    }

    @SafeVarargs
    public static Markers of(List<AnnotationNode>... annotationLists) {
        List<Marker> found = new ArrayList<>();
        for (List<AnnotationNode> list : annotationLists) {
            if (list != null) {
                for (AnnotationNode node : list) {
                    found.add(Marker.of(node));
                }
            }
        }
        return found.isEmpty() ? NONE : new Markers(found);
    }

    public static Markers of(Marker... markers) {
        return new Markers(List.of(markers));
    }

    /**
     * Returns the first marker of the given annotation type.
     */
    public Optional<Marker> find(Class<? extends Annotation> type) {
        for (Marker marker : markers) {
            if (marker.is(type)) {
                return Optional.of(marker);
            }
        }
        return Optional.empty();
    }

    public boolean has(Class<? extends Annotation> type) {
        return find(type).isPresent();
    }

    public List<Marker> all() {
        return markers;
    }
}
