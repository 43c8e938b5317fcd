package net.pilotproxy.client.core.file;

import com.sun.jna.Native;
import java.nio.file.Path;
import net.pilotproxy.client.core.ErrorCode;
import net.pilotproxy.client.core.PilotProxyException;
import net.pilotproxy.client.log.PilotLogger;
import net.pilotproxy.client.log.PilotLoggerFactory;

/** Whole-file BSD flock(2) lock, taken on the descriptor the file was opened with. */
class FlagFileLocker implements FileLocker {
  private static final PilotLogger logger = PilotLoggerFactory.getLogger(FlagFileLocker.class);

  private final PosixLibC libC;

  FlagFileLocker(PosixLibC libC) {
    this.libC = libC;
  }

  @Override
  public AcquiredLock lock(OpenedFile file, LockMode mode) throws PilotProxyException {
    Path path = file.getPath();
    if (libC == null) {
      throw new PilotProxyException(
          ErrorCode.LOCK_ERROR, path, "flock is not available on this platform");
    }
    int fd = file.getDescriptor();

    int operation = mode == LockMode.SHARED ? PosixLibC.LOCK_SH : PosixLibC.LOCK_EX;
    int rc;
    int errno = 0;
    do {
      rc = libC.flock(fd, operation);
      if (rc != 0) {
        errno = Native.getLastError();
      }
    } while (rc != 0 && errno == PosixLibC.EINTR);

    if (rc != 0) {
      throw new PilotProxyException(ErrorCode.LOCK_ERROR, path, "flock failed, errno = " + errno);
    }
    logger.trace("Obtained {} flock on {}", mode, path);
    return () -> {
      if (libC.flock(fd, PosixLibC.LOCK_UN) != 0) {
        logger.debug("Failed to unlock {}, errno = {}", path, Native.getLastError());
      }
    };
  }
}
