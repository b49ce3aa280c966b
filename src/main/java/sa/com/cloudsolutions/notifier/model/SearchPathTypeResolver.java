package sa.com.cloudsolutions.notifier.model;

import net.bytebuddy.dynamic.ClassFileLocator;
import org.objectweb.asm.ClassReader;
import org.objectweb.asm.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Resolves classes from a list of search locations through Byte Buddy's {@link ClassFileLocator}.
 *
 * A directory on the search path contributes its class files and every JAR directly inside it; a JAR contributes
 * its entries. The class loader that loaded the weaver is always searched last, which covers the JDK and the
 * weaver's own class path. Definitions are parsed without method bodies and cached for the life of the resolver; the cache is safe
 * for concurrent use by the load-time agent.
 */
public final class SearchPathTypeResolver implements TypeResolver, Closeable {
    private static final Logger logger = LoggerFactory.getLogger(SearchPathTypeResolver.class);
    private static final int PARSING_OPTIONS = ClassReader.SKIP_CODE | ClassReader.SKIP_DEBUG | ClassReader.SKIP_FRAMES;

    private final ClassFileLocator locator;
    private final Map<String, Optional<TypeModel>> cache = new ConcurrentHashMap<>();

    public SearchPathTypeResolver(ClassFileLocator locator) {
        this.locator = locator;
    }

    public static SearchPathTypeResolver of(List<Path> searchPaths) throws IOException {
        List<ClassFileLocator> locators = new ArrayList<>();
        for (Path searchPath : searchPaths) {
            if (Files.isDirectory(searchPath)) {
                locators.add(new ClassFileLocator.ForFolder(searchPath.toFile()));
                List<Path> jars;
                try (Stream<Path> list = Files.list(searchPath)) {
                    jars = list.filter(p -> p.toString().endsWith(".jar")).sorted().collect(Collectors.toList());
                }
                for (Path jar : jars) {
                    locators.add(ClassFileLocator.ForJarFile.of(jar.toFile()));
                }
            } else if (Files.isRegularFile(searchPath)) {
                locators.add(ClassFileLocator.ForJarFile.of(searchPath.toFile()));
            } else {
                logger.warn("Ignoring missing search path {}", searchPath);
            }
        }
        locators.add(ClassFileLocator.ForClassLoader.of(SearchPathTypeResolver.class.getClassLoader()));
        logger.debug("Search path: {}", searchPaths);
        return new SearchPathTypeResolver(new ClassFileLocator.Compound(locators));
    }

    @Override
    public Optional<TypeModel> resolve(String internalName) {
        return cache.computeIfAbsent(internalName, this::locate);
    }

    private Optional<TypeModel> locate(String internalName) {
        try {
            ClassFileLocator.Resolution resolution = locator.locate(Type.getObjectType(internalName).getClassName());
            if (!resolution.isResolved()) {
                return Optional.empty();
            }
            return Optional.of(TypeModel.read(resolution.resolve(), PARSING_OPTIONS));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read class " + internalName, e);
        }
    }

    @Override
    public void close() throws IOException {
        locator.close();
    }
}
