package net.pilotproxy.client.core.file;

class NoFileLocker implements FileLocker {
  private static final AcquiredLock NOT_LOCKED = () -> {};

  @Override
  public AcquiredLock lock(OpenedFile file, LockMode mode) {
    return NOT_LOCKED;
  }
}
