package net.pilotproxy.client.core.file;

import java.io.IOException;
import java.nio.channels.FileLock;
import java.nio.channels.NonReadableChannelException;
import java.nio.channels.NonWritableChannelException;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Path;
import net.pilotproxy.client.core.ErrorCode;
import net.pilotproxy.client.core.PilotProxyException;
import net.pilotproxy.client.log.PilotLogger;
import net.pilotproxy.client.log.PilotLoggerFactory;

/**
 * Whole-file POSIX record lock (fcntl F_SETLKW on Unix) through {@link
 * java.nio.channels.FileChannel#lock}.
 */
class RangeFileLocker implements FileLocker {
  private static final PilotLogger logger = PilotLoggerFactory.getLogger(RangeFileLocker.class);

  @Override
  public AcquiredLock lock(OpenedFile file, LockMode mode) throws PilotProxyException {
    Path path = file.getPath();
    FileLock fileLock;
    try {
      fileLock = file.getChannel().lock(0L, Long.MAX_VALUE, mode == LockMode.SHARED);
    } catch (IOException
        | OverlappingFileLockException
        | NonReadableChannelException
        | NonWritableChannelException ex) {
      throw new PilotProxyException(ex, ErrorCode.LOCK_ERROR, path, String.valueOf(ex));
    }
    logger.trace("Obtained {} range lock on {}", mode, path);
    return () -> {
      try {
        fileLock.release();
      } catch (IOException ex) {
        logger.debug("Failed to release range lock on {}: {}", path, ex.getMessage());
      }
    };
  }
}
