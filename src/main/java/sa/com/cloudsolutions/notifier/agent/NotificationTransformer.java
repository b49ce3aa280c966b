package sa.com.cloudsolutions.notifier.agent;

import net.bytebuddy.dynamic.ClassFileLocator;
import org.objectweb.asm.ClassReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sa.com.cloudsolutions.notifier.annotation.Notifier;
import sa.com.cloudsolutions.notifier.model.SearchPathTypeResolver;
import sa.com.cloudsolutions.notifier.model.TypeModel;
import sa.com.cloudsolutions.notifier.model.TypeResolver;
import sa.com.cloudsolutions.notifier.weaver.MarkerScanner;
import sa.com.cloudsolutions.notifier.weaver.NotifyTargetResolver;
import sa.com.cloudsolutions.notifier.weaver.WeaverOptions;

import java.io.IOException;
import java.lang.instrument.ClassFileTransformer;
import java.security.ProtectionDomain;
import java.util.List;

/**
 * Weaves classes carrying {@link Notifier} at load time. Super classes are resolved through the defining class
 * loader, then through any search path given in the agent arguments.
 *
 * Each class file is handled on its own; nested classes are woven when they are loaded.
 * A class that cannot be woven is logged and loaded unchanged.
 */
public class NotificationTransformer implements ClassFileTransformer {
    private static final Logger logger = LoggerFactory.getLogger(NotificationTransformer.class);
    private static final int PEEK_OPTIONS = ClassReader.SKIP_CODE | ClassReader.SKIP_DEBUG | ClassReader.SKIP_FRAMES;
    private static final List<String> EXCLUDED_PREFIXES = List.of(
            "java/", "javax/", "jdk/", "sun/", "com/sun/",
            "sa/com/cloudsolutions/notifier/agent/", "sa/com/cloudsolutions/notifier/model/",
            "sa/com/cloudsolutions/notifier/weaver/");

    private final WeaverOptions options;
    private final SearchPathTypeResolver searchPath;

    public NotificationTransformer(WeaverOptions options) throws IOException {
        this.options = options;
        this.searchPath = options.extraSearchPaths().isEmpty()
                ? null
                : SearchPathTypeResolver.of(options.extraSearchPaths());
    }

    @Override
    public byte[] transform(Module module, ClassLoader loader, String className, Class<?> classBeingRedefined,
                            ProtectionDomain protectionDomain, byte[] classfileBuffer) {
        if (className == null || isExcluded(className)) {
            return null;
        }
        try {
            if (!TypeModel.read(classfileBuffer, PEEK_OPTIONS).markers().has(Notifier.class)) {
                return null;
            }
            TypeModel type = TypeModel.read(classfileBuffer, options.debug() ? 0 : ClassReader.SKIP_DEBUG);
            MarkerScanner scanner = new MarkerScanner(new NotifyTargetResolver(resolverFor(loader)));
            if (!scanner.processType(type)) {
                return null;
            }
            logger.debug("Wove {} at load time", type.name());
            return type.toByteArray();
        } catch (RuntimeException e) {
            logger.error("Failed to weave {}: {}", className.replace('/', '.'), e.getMessage(), e);
            return null; // load the class unwoven
        }
    }

    private TypeResolver resolverFor(ClassLoader loader) {
        TypeResolver resolver = new SearchPathTypeResolver(ClassFileLocator.ForClassLoader.of(loader));
        return searchPath == null ? resolver : resolver.orElse(searchPath);
    }

    private static boolean isExcluded(String className) {
        for (String prefix : EXCLUDED_PREFIXES) {
            if (className.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
