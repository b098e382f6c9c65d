package org.danilorossi.mailchannel.helpers;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.java.Log;
import lombok.val;

/**
 * Lock esclusivo su file: impedisce che due processi facciano polling della stessa casella, dato
 * che l'insieme dei messaggi già visti vive solo in memoria.
 */
@Log
public final class SingleInstanceLock implements AutoCloseable {

  static {
    LogConfigurator.configLog(log);
  }

  @Getter private final Path lockPath;
  private final FileChannel channel;
  private final FileLock lock;

  private SingleInstanceLock(
      @NonNull final Path lockPath, @NonNull final FileChannel channel, @NonNull final FileLock lock) {
    this.lockPath = lockPath;
    this.channel = channel;
    this.lock = lock;
  }

  public static SingleInstanceLock acquire() throws IOException {
    return acquire(defaultLockPath());
  }

  /** Acquisizione non bloccante; se il lock è già preso lancia {@link AlreadyRunningException}. */
  public static SingleInstanceLock acquire(@NonNull final Path lockPath) throws IOException {
    val ch =
        FileChannel.open(lockPath, StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE);
    final FileLock fl;
    try {
      fl = ch.tryLock();
    } catch (OverlappingFileLockException e) {
      // stesso processo
      ch.close();
      throw new AlreadyRunningException(LangUtils.s("Lock already held in this process: {}", lockPath));
    } catch (IOException | RuntimeException e) {
      ch.close();
      throw e;
    }
    if (fl == null) {
      ch.close();
      throw new AlreadyRunningException(LangUtils.s("Lock held by another process: {}", lockPath));
    }

    ch.truncate(0);
    ch.write(ByteBuffer.wrap(buildLockNote().getBytes(StandardCharsets.UTF_8)));
    ch.force(true);
    return new SingleInstanceLock(lockPath, ch, fl);
  }

  public static Path defaultLockPath() {
    return FileSystemUtils.getLockFilePath();
  }

  private static String buildLockNote() {
    return LangUtils.s("pid={} startedAt={}", ProcessHandle.current().pid(), Instant.now());
  }

  @Override
  public void close() {
    try {
      lock.release();
      channel.close();
      Files.deleteIfExists(lockPath);
    } catch (IOException e) {
      LangUtils.warn(log, "Impossibile rilasciare il lock {}: {}", lockPath, LangUtils.exMsg(e));
    }
  }

  /** Lanciata quando un'altra istanza è già in esecuzione. */
  public static final class AlreadyRunningException extends RuntimeException {
    public AlreadyRunningException(final String msg) {
      super(msg);
    }
  }
}
