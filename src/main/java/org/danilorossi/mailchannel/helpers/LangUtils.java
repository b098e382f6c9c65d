package org.danilorossi.mailchannel.helpers;

import java.util.logging.Level;
import java.util.logging.Logger;
import lombok.NonNull;
import lombok.experimental.UtilityClass;

@UtilityClass
public class LangUtils {

  /** True se la stringa è null, vuota o composta solo da spazi. */
  public static boolean empty(final String s) {
    return s == null || s.isBlank();
  }

  public static String nz(final String s) {
    return s == null ? "" : s;
  }

  public static String normalize(final String s) {
    return s == null ? "" : s.trim();
  }

  public static String exMsg(@NonNull final Throwable t) {
    return empty(t.getMessage()) ? t.toString() : t.getMessage();
  }

  public static String rootCauseMsg(final Throwable t) {
    if (t == null) return "Null Throwable";
    if (t.getCause() != null && t.getCause() != t) return rootCauseMsg(t.getCause());
    return exMsg(t);
  }

  /** Formatta sostituendo i segnaposto "{}" in ordine. */
  public static String s(final String format, final Object... values) {
    if (values == null || values.length == 0) return normalize(format);
    return String.format(nz(format).replace("%", "%%").replace("{}", "%s"), values);
  }

  public static void l(Logger logger, Level level, String format, Throwable t, Object... values) {
    if (logger == null || level == null || !logger.isLoggable(level)) return;
    final String msg = s(format, values);
    if (t == null) logger.log(level, msg);
    else logger.log(level, msg, t);
  }

  public static void l(Logger logger, Level level, String format, Object... values) {
    l(logger, level, format, null, values);
  }

  public static void info(Logger logger, String format, Object... values) {
    l(logger, Level.INFO, format, values);
  }

  public static void warn(Logger logger, String format, Object... values) {
    l(logger, Level.WARNING, format, values);
  }

  public static void err(Logger logger, String format, Object... values) {
    l(logger, Level.SEVERE, format, values);
  }

  public static void debug(Logger logger, String format, Object... values) {
    l(logger, Level.FINE, format, values);
  }

  public static void warn(Logger logger, String format, Throwable t, Object... values) {
    l(logger, Level.WARNING, format, t, values);
  }

  public static void err(Logger logger, String format, Throwable t, Object... values) {
    l(logger, Level.SEVERE, format, t, values);
  }

  public static void debug(Logger logger, String format, Throwable t, Object... values) {
    l(logger, Level.FINE, format, t, values);
  }
}
