package sa.com.cloudsolutions.notifier.weaver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sa.com.cloudsolutions.notifier.model.ModuleImage;
import sa.com.cloudsolutions.notifier.model.SearchPathTypeResolver;
import sa.com.cloudsolutions.notifier.model.TypeModel;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Rewrites a compiled module so that the setters of its notifier classes call their notify target.
 *
 * One run loads the module, weaves every class, and writes the module back only if a setter was rewritten.
 * A {@link WeavingException} leaves the module on disk untouched.
 */
public class NotificationWeaver {
    private static final Logger logger = LoggerFactory.getLogger(NotificationWeaver.class);

    private final WeaverOptions options;

    /**
     * @param modulePath JAR file or class directory to rewrite in place
     */
    public NotificationWeaver(Path modulePath) {
        this(WeaverOptions.forModule(modulePath));
    }

    public NotificationWeaver(WeaverOptions options) {
        this.options = options;
    }

    /**
     * @return {@code true} if the module was rewritten, {@code false} if nothing needed weaving
     */
    public boolean insertNotifications() throws IOException {
        ModuleImage module = ModuleImage.load(options.modulePath(), options.debug());

        try (SearchPathTypeResolver searchPath = SearchPathTypeResolver.of(options.searchPaths())) {
            MarkerScanner scanner = new MarkerScanner(new NotifyTargetResolver(module.orElse(searchPath)));
            for (TypeModel type : module.topLevelTypes()) {
                scanner.processType(type);
            }
        }

        if (!module.isModified()) {
            logger.info("No notifications to weave into {}", options.modulePath());
            return false;
        }
        module.write();
        return true;
    }
}
