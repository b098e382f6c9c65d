package org.danilorossi.mailchannel.helpers;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.NonNull;
import lombok.experimental.UtilityClass;
import lombok.val;

@UtilityClass
public class FileSystemUtils {

  public static final String PROP_HOME = "mailchannel.home";
  private static final String DIR_DATA = "data";

  private static final String CONFIG_JSON = "email-channel.json";

  /** Nome predefinito del file di lock sotto data/. */
  public static final String LOCK_FILENAME = "mailchannel.lock";

  /**
   * Cartella "data" per configurazione, lock e log. Ordine: ENV DEV (cwd/data), poi
   * -Dmailchannel.home, poi la cartella del jar, infine cwd/data.
   */
  public static Path getDataDir() {
    if (!LangUtils.empty(System.getenv("DEV"))) return ensureDir(cwd().resolve(DIR_DATA));

    val override = System.getProperty(PROP_HOME);
    if (!LangUtils.empty(override)) return ensureDir(normalize(Paths.get(override)));

    try {
      val base = resolveExecutableBaseDir();
      if (base != null) return ensureDir(base.resolve(DIR_DATA));
    } catch (URISyntaxException | RuntimeException __) {
      // fallback sotto
    }

    return ensureDir(cwd().resolve(DIR_DATA));
  }

  /** Path a email-channel.json. */
  public static Path getConfigJson() {
    return getDataDir().resolve(CONFIG_JSON);
  }

  public static Path getLockFilePath() {
    return getDataDir().resolve(LOCK_FILENAME);
  }

  /** Restituisce un file generico sotto data/. */
  public static Path getDataPath(@NonNull final String fileName) {
    return getDataDir().resolve(fileName);
  }

  /** Legge testo UTF-8. */
  public static String readUtf8(@NonNull final Path file) throws IOException {
    return Files.readString(normalize(file), StandardCharsets.UTF_8);
  }

  private static Path cwd() {
    return normalize(Paths.get("."));
  }

  private static Path normalize(@NonNull final Path p) {
    return p.toAbsolutePath().normalize();
  }

  private static Path ensureDir(@NonNull final Path dir) {
    try {
      Files.createDirectories(dir);
      return dir;
    } catch (IOException e) {
      throw new UncheckedIOException(LangUtils.s("Cannot create directory: {}", dir), e);
    }
  }

  /** jar ⇒ parent; .../target/classes ⇒ .../target; altrimenti la location stessa. */
  private static Path resolveExecutableBaseDir() throws URISyntaxException {
    val cs = FileSystemUtils.class.getProtectionDomain().getCodeSource();
    if (cs == null) return null;
    val loc = normalize(Paths.get(cs.getLocation().toURI()));
    if (Files.isRegularFile(loc)) return normalize(loc.getParent());
    val name = loc.getFileName() != null ? loc.getFileName().toString() : "";
    if ("classes".equals(name)) return normalize(loc.getParent());
    return loc;
  }
}
