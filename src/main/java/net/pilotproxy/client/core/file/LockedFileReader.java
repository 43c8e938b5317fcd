package net.pilotproxy.client.core.file;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import net.pilotproxy.client.core.ErrorCode;
import net.pilotproxy.client.core.PilotProxyException;
import net.pilotproxy.client.log.PilotLogger;
import net.pilotproxy.client.log.PilotLoggerFactory;

/**
 * Reads a small private file, such as a proxy certificate, that its owner may rewrite at any
 * moment.
 *
 * <p>The file is opened once, without following links and with the real user identity when
 * running as effective root. It is locked with the requested advisory lock through that open,
 * checked for owner-only access and then read until two consecutive stats of the opened
 * descriptor agree on size, modification time, change time and inode. The last check also catches
 * writers that do not take the lock.
 */
public class LockedFileReader {
  private static final PilotLogger logger = PilotLoggerFactory.getLogger(LockedFileReader.class);

  // largest array size the JVM reliably allocates
  private static final long MAX_BUFFER_SIZE = Integer.MAX_VALUE - 8;

  private final PosixIdentity identity;
  private final PosixLibC libC;
  private final FileStatter statter;
  private final ReadRetryPolicy retryPolicy;

  public LockedFileReader(PosixIdentity identity) {
    this(identity, ReadRetryPolicy.DEFAULT);
  }

  public LockedFileReader(PosixIdentity identity, ReadRetryPolicy retryPolicy) {
    this(identity, new PosixFileStatter(), retryPolicy);
  }

  public LockedFileReader(
      PosixIdentity identity, FileStatter statter, ReadRetryPolicy retryPolicy) {
    this.identity = identity;
    this.libC = PosixLibC.INSTANCE;
    this.statter = statter;
    this.retryPolicy = retryPolicy;
  }

  /**
   * @param path file to read
   * @param lockType advisory lock taken in shared mode for the duration of the read
   * @return the file contents; the length equals the size seen by the last matching stat
   * @throws PilotProxyException IO_ERROR, LOCK_ERROR, PERMISSION_ERROR, PRIVILEGE_ERROR,
   *     OUT_OF_MEMORY or TOO_MANY_RETRIES
   */
  public byte[] read(Path path, LockType lockType) throws PilotProxyException {
    return read(path, lockType.newLocker());
  }

  byte[] read(Path path, FileLocker locker) throws PilotProxyException {
    int realUid = identity.getRealUid();
    try (PrivilegeGuard ignored = PrivilegeGuard.dropToRealIdentity(identity)) {
      return readLocked(path, locker, realUid);
    }
  }

  private byte[] readLocked(Path path, FileLocker locker, int realUid)
      throws PilotProxyException {
    try (OpenedFile file = OpenedFile.open(path, libC);
        AcquiredLock lock = locker.lock(file, LockMode.SHARED)) {
      FileChannel channel = file.getChannel();
      FileSnapshot expected = stat(file);
      FileUtil.throwWhenNotOwnerOnly(path, expected, realUid);

      byte[] buffer = allocate(path, expected.getSize());
      for (int attempt = 1; ; attempt++) {
        int bytesRead = readFully(channel, buffer);
        FileSnapshot current = stat(file);
        if (current.isUnchangedSince(expected)) {
          if (bytesRead != buffer.length) {
            throw new PilotProxyException(
                ErrorCode.IO_ERROR,
                path,
                String.format("short read, %d of %d bytes", bytesRead, buffer.length));
          }
          logger.debug("Read {} bytes from {} in {} attempt(s)", bytesRead, path, attempt);
          return buffer;
        }

        if (attempt >= retryPolicy.getMaxAttempts()) {
          logger.warn("File {} kept changing, giving up after {} attempts", path, attempt);
          throw new PilotProxyException(
              ErrorCode.TOO_MANY_RETRIES, path, retryPolicy.getMaxAttempts());
        }
        logger.debug("File {} changed while reading: {} -> {}", path, expected, current);
        buffer = allocate(path, current.getSize());
        expected = current;
        pause(path);
        channel.position(0L);
      }
    } catch (IOException ex) {
      throw new PilotProxyException(ex, ErrorCode.IO_ERROR, path, ex.getMessage());
    }
  }

  /** Stats the opened inode through its descriptor, never the path it was opened by. */
  private FileSnapshot stat(OpenedFile file) throws PilotProxyException {
    try {
      return statter.stat(file.getDescriptorPath());
    } catch (IOException ex) {
      logger.warn("Cannot stat {}: {}", file.getPath(), ex.getMessage());
      throw new PilotProxyException(ex, ErrorCode.IO_ERROR, file.getPath(), ex.getMessage());
    }
  }

  private static byte[] allocate(Path path, long size) throws PilotProxyException {
    if (size < 0 || size > MAX_BUFFER_SIZE) {
      throw new PilotProxyException(ErrorCode.OUT_OF_MEMORY, path, size);
    }
    try {
      return new byte[(int) size];
    } catch (OutOfMemoryError err) {
      throw new PilotProxyException(err, ErrorCode.OUT_OF_MEMORY, path, size);
    }
  }

  /** Reads until the buffer is full or the end of the file is reached. */
  private static int readFully(FileChannel channel, byte[] buffer) throws IOException {
    ByteBuffer target = ByteBuffer.wrap(buffer);
    while (target.hasRemaining()) {
      if (channel.read(target) < 0) {
        break;
      }
    }
    return target.position();
  }

  private void pause(Path path) throws PilotProxyException {
    try {
      retryPolicy.pause();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new PilotProxyException(ex, ErrorCode.IO_ERROR, path, "interrupted while waiting");
    }
  }
}
