package sa.com.cloudsolutions.notifier.model;

import org.objectweb.asm.ClassReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;
import java.util.jar.JarOutputStream;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A compiled module: either a JAR file or a directory of class files. Class entries are parsed into
 * {@link TypeModel}s arranged by nesting; everything else is carried along untouched.
 */
public final class ModuleImage implements TypeResolver {
    private static final Logger logger = LoggerFactory.getLogger(ModuleImage.class);
    private static final String CLASS_SUFFIX = ".class";

    private final Path path;
    private final boolean directory;
    /** Every entry in original order, keyed by its path relative to the module root. */
    private final Map<String, byte[]> entries;
    /** Original JAR entries, for their timestamps, comments and extra fields. Empty for directories. */
    private final Map<String, JarEntry> jarEntries;
    /** Parsed class entries keyed by entry path. */
    private final Map<String, TypeModel> typesByEntry;
    private final Map<String, TypeModel> typesByName = new LinkedHashMap<>();
    private final List<TypeModel> topLevelTypes = new ArrayList<>();

    private ModuleImage(Path path, boolean directory, Map<String, byte[]> entries, Map<String, JarEntry> jarEntries,
                        int parsingOptions) {
        this.path = path;
        this.directory = directory;
        this.entries = entries;
        this.jarEntries = jarEntries;
        this.typesByEntry = new LinkedHashMap<>();
        for (Map.Entry<String, byte[]> entry : entries.entrySet()) {
            if (isWeavableClass(entry.getKey())) {
                TypeModel type = TypeModel.read(entry.getValue(), parsingOptions);
                typesByEntry.put(entry.getKey(), type);
                typesByName.put(type.internalName(), type);
            }
        }
        for (TypeModel type : typesByName.values()) {
            String outer = type.outerName();
            TypeModel outerType = outer == null ? null : typesByName.get(outer);
            if (outerType != null) {
                outerType.addNestedType(type);
            } else {
                topLevelTypes.add(type);
            }
        }
    }

    /**
     * Loads a JAR file or class directory.
     *
     * @param debug keep debug attributes (line numbers, local variable names) of rewritten classes; without it
     *              classes are parsed with {@link ClassReader#SKIP_DEBUG}
     */
    public static ModuleImage load(Path path, boolean debug) throws IOException {
        int options = debug ? 0 : ClassReader.SKIP_DEBUG;
        ModuleImage image;
        if (Files.isDirectory(path)) {
            image = new ModuleImage(path, true, readDirectory(path), Map.of(), options);
        } else if (Files.isRegularFile(path)) {
            Map<String, JarEntry> jarEntries = new LinkedHashMap<>();
            image = new ModuleImage(path, false, readJar(path, jarEntries), jarEntries, options);
        } else {
            throw new IOException("Module not found: " + path);
        }
        logger.info("Loaded {} with {} classes", path, image.typesByName.size());
        return image;
    }

    private static boolean isWeavableClass(String entryName) {
        return entryName.endsWith(CLASS_SUFFIX)
                && !entryName.startsWith("META-INF/")
                && !entryName.endsWith("module-info.class")
                && !entryName.endsWith("package-info.class");
    }

    private static Map<String, byte[]> readJar(Path jar, Map<String, JarEntry> jarEntries) throws IOException {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        try (JarFile file = new JarFile(jar.toFile())) {
            Enumeration<JarEntry> all = file.entries();
            while (all.hasMoreElements()) {
                JarEntry entry = all.nextElement();
                jarEntries.put(entry.getName(), entry);
                if (entry.isDirectory()) {
                    entries.put(entry.getName(), null);
                    continue;
                }
                try (InputStream in = file.getInputStream(entry)) {
                    entries.put(entry.getName(), in.readAllBytes());
                }
            }
        }
        return entries;
    }

    private static Map<String, byte[]> readDirectory(Path root) throws IOException {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        List<Path> files;
        try (Stream<Path> walk = Files.walk(root)) {
            files = walk.filter(p -> p.toString().endsWith(CLASS_SUFFIX)).sorted().collect(Collectors.toList());
        }
        for (Path file : files) {
            String name = root.relativize(file).toString().replace(file.getFileSystem().getSeparator(), "/");
            entries.put(name, Files.readAllBytes(file));
        }
        return entries;
    }

    public Path path() {
        return path;
    }

    public Collection<TypeModel> types() {
        return Collections.unmodifiableCollection(typesByName.values());
    }

    /**
     * Types that are not nested in another type of this module. Nested types are reachable through
     * {@link TypeModel#nestedTypes()}.
     */
    public List<TypeModel> topLevelTypes() {
        return Collections.unmodifiableList(topLevelTypes);
    }

    public Optional<TypeModel> find(String internalName) {
        return Optional.ofNullable(typesByName.get(internalName));
    }

    @Override
    public Optional<TypeModel> resolve(String internalName) {
        return find(internalName);
    }

    public boolean isModified() {
        return typesByName.values().stream().anyMatch(TypeModel::isModified);
    }

    public List<TypeModel> modifiedTypes() {
        return typesByName.values().stream().filter(TypeModel::isModified).collect(Collectors.toList());
    }

    /**
     * Writes the module back to the path it was loaded from. All rewritten classes are serialized before
     * anything touches the disk, so a failure while serializing leaves the module as it was.
     */
    public void write() throws IOException {
        Map<String, byte[]> rewritten = new LinkedHashMap<>();
        for (Map.Entry<String, TypeModel> entry : typesByEntry.entrySet()) {
            if (entry.getValue().isModified()) {
                rewritten.put(entry.getKey(), entry.getValue().toByteArray());
            }
        }
        if (directory) {
            writeDirectory(rewritten);
        } else {
            writeJar(rewritten);
        }
        logger.info("Wrote {} ({} classes rewritten)", path, rewritten.size());
    }

    private void writeDirectory(Map<String, byte[]> rewritten) throws IOException {
        for (Map.Entry<String, byte[]> entry : rewritten.entrySet()) {
            Path target = path.resolve(entry.getKey());
            Path temp = target.resolveSibling(target.getFileName() + ".tmp");
            Files.write(temp, entry.getValue());
            move(temp, target);
        }
    }

    private void writeJar(Map<String, byte[]> rewritten) throws IOException {
        Path temp = Files.createTempFile(path.toAbsolutePath().getParent(), path.getFileName().toString(), ".tmp");
        try {
            try (OutputStream out = Files.newOutputStream(temp); JarOutputStream jar = new JarOutputStream(out)) {
                for (Map.Entry<String, byte[]> entry : entries.entrySet()) {
                    jar.putNextEntry(copyOf(entry.getKey()));
                    byte[] content = rewritten.getOrDefault(entry.getKey(), entry.getValue());
                    if (content != null) {
                        jar.write(content);
                    }
                    jar.closeEntry();
                }
            }
            copyPermissions(path, temp);
            move(temp, path);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    /**
     * A new entry carrying the original's timestamp, comment and extra fields. Sizes and CRC are left for the
     * stream to compute, since rewritten classes change them.
     */
    private JarEntry copyOf(String name) {
        JarEntry copy = new JarEntry(name);
        JarEntry original = jarEntries.get(name);
        if (original != null) {
            if (original.getTime() != -1) {
                copy.setTime(original.getTime());
            }
            copy.setExtra(original.getExtra());
            copy.setComment(original.getComment());
        }
        return copy;
    }

    // temp files are created owner-only on POSIX
    private static void copyPermissions(Path source, Path target) throws IOException {
        if (Files.getFileStore(source).supportsFileAttributeView(PosixFileAttributeView.class)) {
            Files.setPosixFilePermissions(target, Files.getPosixFilePermissions(source));
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Override
    public String toString() {
        return "ModuleImage[" + path + "]";
    }
}
