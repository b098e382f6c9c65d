package org.danilorossi.mailchannel.helpers;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import lombok.NonNull;
import lombok.experimental.UtilityClass;
import lombok.val;

/**
 * Configurazione centralizzata di java.util.logging. Ogni classe con {@code @Log} chiama {@link
 * #configLog(Logger)} nel proprio blocco statico.
 *
 * <p>Proprietà di sistema:
 *
 * <ul>
 *   <li>{@code LOG_LEVEL}: livello JUL o alias DEBUG/TRACE (default INFO)
 *   <li>{@code mailchannel.log.file}: nome del file di log sotto data/ (rotazione 1MB x 5); se
 *       assente si logga su console
 * </ul>
 */
@UtilityClass
public class LogConfigurator {

  public static final String PROP_LOG_FILE = "mailchannel.log.file";
  public static final String PROP_LOG_LEVEL = "LOG_LEVEL";

  private static final Handler LOG_HANDLER;
  private static final AtomicBoolean ONCE = new AtomicBoolean(false);

  private static final Map<String, Level> ALIASES =
      Map.of("DEBUG", Level.FINE, "TRACE", Level.FINEST, "WARN", Level.WARNING, "ERROR", Level.SEVERE);

  static {
    LOG_HANDLER = createHandler(System.getProperty(PROP_LOG_FILE, ""));
    Runtime.getRuntime()
        .addShutdownHook(new Thread(LOG_HANDLER::close, "log-handler-shutdown"));
  }

  private static Handler createHandler(final String fileName) {
    Handler handler = null;
    if (!LangUtils.empty(fileName)) {
      try {
        handler =
            new FileHandler(
                FileSystemUtils.getDataPath(fileName).toAbsolutePath().toString(),
                1_000_000,
                5,
                true);
      } catch (IOException | RuntimeException ex) {
        System.err.println(
            LangUtils.s(
                "Cannot open log file {}, logging to console: {}", fileName, LangUtils.exMsg(ex)));
      }
    }
    if (handler == null) handler = new ConsoleHandler();
    handler.setFormatter(new SimpleFormatter());
    handler.setLevel(Level.ALL);
    try {
      handler.setEncoding("UTF-8");
    } catch (IOException ex) {
      System.err.println(LangUtils.s("UTF-8 not accepted by log handler: {}", LangUtils.exMsg(ex)));
    }
    return handler;
  }

  public static void configLog(@NonNull final Logger logger) {
    for (val h : logger.getHandlers()) logger.removeHandler(h);
    logger.addHandler(LOG_HANDLER);
    logger.setLevel(resolveLogLevel(System.getProperty(PROP_LOG_LEVEL, "INFO")));
    logger.setUseParentHandlers(false);
    if (ONCE.compareAndSet(false, true))
      LogManager.getLogManager().getLogger("").setLevel(logger.getLevel());
  }

  static Level resolveLogLevel(@NonNull final String levelName) {
    val key = levelName.trim().toUpperCase();
    if (ALIASES.containsKey(key)) return ALIASES.get(key);
    try {
      return Level.parse(key);
    } catch (IllegalArgumentException e) {
      return Level.INFO;
    }
  }
}
