package sa.com.cloudsolutions.notifier.weaver;

import sa.com.cloudsolutions.notifier.annotation.Notify;
import sa.com.cloudsolutions.notifier.model.Marker;
import sa.com.cloudsolutions.notifier.model.PropertyModel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Computes the names a woven setter reports, from the property's {@link Notify} marker alone. The implicit-mode
 * default is left to the caller.
 */
public class PropertyNameResolver {

    /**
     * @return names in declaration order, duplicates kept; may contain {@code null}; empty when unmarked
     */
    public List<String> resolve(PropertyModel property) {
        Optional<Marker> marker = property.marker(Notify.class);
        if (marker.isEmpty()) {
            return List.of();
        }
        Marker notify = marker.get();

        if (Boolean.TRUE.equals(notify.argument("unnamed"))) {
            return Collections.singletonList(null);
        }
        if (!notify.hasArgument("value")) {
            return List.of(property.name());
        }
        Object value = notify.argument("value");
        if (value == null) {
            return Collections.singletonList(null);
        }
        List<?> declared = (List<?>) value;
        if (declared.isEmpty()) {
            return List.of(property.name());
        }
        List<String> names = new ArrayList<>(declared.size());
        for (Object name : declared) {
            names.add((String) name);
        }
        return names;
    }
}
