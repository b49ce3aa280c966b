package sa.com.cloudsolutions.notifier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sa.com.cloudsolutions.notifier.weaver.NotificationWeaver;
import sa.com.cloudsolutions.notifier.weaver.WeaverOptions;
import sa.com.cloudsolutions.notifier.weaver.WeavingException;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Weaves change notifications into a JAR or class directory, in place.
 * Usage:
 *   java -jar notifier-weaver.jar <module.jar|classes-dir> [--debug] [--search-path <dir|jar>]...
 * Rewritten classes are stripped of source file names, line numbers and local variable names unless --debug
 * is given; untouched classes are copied as they are.
 * Exit codes: 0 done (woven or nothing to do), 1 weaving error, 2 bad usage, 3 I/O failure.
 */
public class NotifierWeaverCli {
    private static final Logger logger = LoggerFactory.getLogger(NotifierWeaverCli.class);
    private static final String USAGE =
            "Usage: NotifierWeaverCli <module.jar|classes-dir> [--debug] [--search-path <dir|jar>]...\n"
                    + "  --debug        keep source file names and line numbers in rewritten classes"
                    + " (stripped otherwise)\n"
                    + "  --search-path  extra directory or JAR used to resolve base classes";

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        WeaverOptions options;
        try {
            options = WeaverOptions.fromArgs(args);
        } catch (IllegalArgumentException e) {
            logger.error("{}\n{}", e.getMessage(), USAGE);
            return 2;
        }

        try {
            boolean woven = new NotificationWeaver(options).insertNotifications();
            logger.info(woven ? "Notifications woven into {}" : "{} left unchanged", options.modulePath());
            return 0;
        } catch (WeavingException e) {
            logger.error("Weaving failed, {} left unchanged: {}", options.modulePath(), e.getMessage());
            return 1;
        } catch (IOException | UncheckedIOException e) {
            logger.error("Could not read or write {}", options.modulePath(), e);
            return 3;
        }
    }
}
