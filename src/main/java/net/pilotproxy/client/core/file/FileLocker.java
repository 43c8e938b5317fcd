package net.pilotproxy.client.core.file;

import net.pilotproxy.client.core.PilotProxyException;

/** One advisory whole-file locking mechanism. */
public interface FileLocker {
  /**
   * Blocks until the whole opened file is locked in the given mode.
   *
   * @param file opened file, locked through its own descriptor
   * @param mode shared or exclusive
   * @return the held lock
   * @throws PilotProxyException LOCK_ERROR if the lock cannot be obtained
   */
  AcquiredLock lock(OpenedFile file, LockMode mode) throws PilotProxyException;
}
