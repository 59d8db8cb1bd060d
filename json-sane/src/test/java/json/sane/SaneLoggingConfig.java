package json.sane;

import org.junit.jupiter.api.BeforeAll;

import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Base class for json-sane tests that configures logging.
///
/// Honours the `java.util.logging.ConsoleHandler.level` system property, so
/// `-Djava.util.logging.ConsoleHandler.level=FINER` shows the path walks.
abstract class SaneLoggingConfig {

    @BeforeAll
    static void configureLogging() {
        final var levelStr = System.getProperty("java.util.logging.ConsoleHandler.level", "INFO");
        final var level = Level.parse(levelStr);

        final var rootLogger = Logger.getLogger("");
        rootLogger.setLevel(level);
        for (final var handler : rootLogger.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                handler.setLevel(level);
            }
        }

        Logger.getLogger("json.sane").setLevel(level);
    }
}
