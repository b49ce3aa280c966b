package sa.com.cloudsolutions.notifier.weaver;

import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.CodeSource;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Settings for one weaving run.
 *
 * Command line form: {@code <module> [--debug] [--search-path <dir|jar>]...}. Without {@code --debug} the
 * rewritten classes lose their debug attributes (source file, line numbers, local variable names).
 * Agent argument form: {@code [strip-debug,]search-path=<dir|jar>[;<dir|jar>...]}. Classes woven at load time keep
 * their debug attributes unless {@code strip-debug} is given.
 */
public final class WeaverOptions {
    private final Path modulePath;
    private final boolean debug;
    private final List<Path> extraSearchPaths;

    public WeaverOptions(Path modulePath, boolean debug, List<Path> extraSearchPaths) {
        this.modulePath = modulePath;
        this.debug = debug;
        this.extraSearchPaths = Collections.unmodifiableList(new ArrayList<>(extraSearchPaths));
    }

    public static WeaverOptions forModule(Path modulePath) {
        return new WeaverOptions(modulePath, false, List.of());
    }

    /**
     * @throws IllegalArgumentException on unknown flags, a missing flag value or a missing module path
     */
    public static WeaverOptions fromArgs(String[] args) {
        Path module = null;
        boolean debug = false;
        List<Path> searchPaths = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--debug" -> debug = true;
                case "--search-path" -> {
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("--search-path requires a value");
                    }
                    searchPaths.add(Paths.get(args[++i]));
                }
                default -> {
                    if (arg.startsWith("--")) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                    if (module != null) {
                        throw new IllegalArgumentException("Only one module may be woven per run, got " + module + " and " + arg);
                    }
                    module = Paths.get(arg);
                }
            }
        }
        if (module == null) {
            throw new IllegalArgumentException("No module path given");
        }
        return new WeaverOptions(module, debug, searchPaths);
    }

    /**
     * Parses the agent argument string. There is no module path in agent mode.
     */
    public static WeaverOptions fromAgentArgs(String agentArgs) {
        boolean debug = true;
        List<Path> searchPaths = new ArrayList<>();
        if (agentArgs != null) {
            for (String option : agentArgs.split(",")) {
                String trimmed = option.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                if (trimmed.equals("debug")) {
                    debug = true;
                } else if (trimmed.equals("strip-debug")) {
                    debug = false;
                } else if (trimmed.startsWith("search-path=")) {
                    for (String path : trimmed.substring("search-path=".length()).split(";")) {
                        if (!path.isBlank()) {
                            searchPaths.add(Paths.get(path.trim()));
                        }
                    }
                } else {
                    throw new IllegalArgumentException("Unknown agent option: " + trimmed);
                }
            }
        }
        return new WeaverOptions(null, debug, searchPaths);
    }

    public Path modulePath() {
        return modulePath;
    }

    public boolean debug() {
        return debug;
    }

    public List<Path> extraSearchPaths() {
        return extraSearchPaths;
    }

    /**
     * The directory holding the running weaver, the directory holding the module, then any extra paths.
     */
    public List<Path> searchPaths() {
        List<Path> paths = new ArrayList<>();
        Path toolDirectory = toolDirectory();
        if (toolDirectory != null) {
            paths.add(toolDirectory);
        }
        if (modulePath != null) {
            Path parent = modulePath.toAbsolutePath().getParent();
            if (parent != null && !paths.contains(parent)) {
                paths.add(parent);
            }
        }
        paths.addAll(extraSearchPaths);
        return paths;
    }

    private static Path toolDirectory() {
        CodeSource source = WeaverOptions.class.getProtectionDomain().getCodeSource();
        if (source == null || source.getLocation() == null) {
            return null;
        }
        try {
            Path location = Paths.get(source.getLocation().toURI());
            return Files.isDirectory(location) ? location : location.getParent();
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
    }
}
