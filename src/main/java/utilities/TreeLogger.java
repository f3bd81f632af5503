package utilities;

import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/** Static logging facade for tree construction and queries. */
public class TreeLogger {

    // when set, records are also appended to this file
    public static final String LOG_FILE_PROPERTY = "suffixtree.log.file";

    private static final Logger logger = Logger.getLogger(TreeLogger.class.getName());

    static {
        // own console handler only, so records are not printed twice
        logger.setUseParentHandlers(false);

        ConsoleHandler consoleHandler = new ConsoleHandler();
        consoleHandler.setLevel(Level.INFO);
        logger.addHandler(consoleHandler);

        String logFile = System.getProperty(LOG_FILE_PROPERTY);
        if (logFile != null && !logFile.isBlank()) {
            try {
                FileHandler fileHandler = new FileHandler(logFile, true); // true = append mode
                fileHandler.setLevel(Level.ALL);
                fileHandler.setFormatter(new SimpleFormatter());
                logger.addHandler(fileHandler);
            } catch (Exception e) {
                System.err.println("Failed to open log file " + logFile + ": " + e.getMessage());
            }
        }

        logger.setLevel(Level.ALL);
    }

    private TreeLogger() {
    }

    public static void info(String msg) {
        logger.info(msg);
    }

    public static void warning(String msg) {
        logger.warning(msg);
    }

    public static void error(String msg) {
        logger.severe(msg);
    }

    public static void debug(String msg) {
        logger.fine(msg);
    }

    public static void trace(String msg) {
        logger.finest(msg);
    }
}
