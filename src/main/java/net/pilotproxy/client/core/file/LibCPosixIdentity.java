package net.pilotproxy.client.core.file;

import com.sun.jna.Native;
import java.io.IOException;

/** {@link PosixIdentity} backed by the process credentials through libc. */
public class LibCPosixIdentity implements PosixIdentity {
  private final PosixLibC libC;

  LibCPosixIdentity(PosixLibC libC) {
    this.libC = libC;
  }

  /**
   * @return identity of the current process
   * @throws IllegalStateException when the C library cannot be loaded on this platform
   */
  public static LibCPosixIdentity getInstance() {
    if (PosixLibC.INSTANCE == null) {
      throw new IllegalStateException("C library is not available on this platform");
    }
    return new LibCPosixIdentity(PosixLibC.INSTANCE);
  }

  @Override
  public int getRealUid() {
    return libC.getuid();
  }

  @Override
  public int getEffectiveUid() {
    return libC.geteuid();
  }

  @Override
  public int getRealGid() {
    return libC.getgid();
  }

  @Override
  public int getEffectiveGid() {
    return libC.getegid();
  }

  @Override
  public void setEffectiveUid(int euid) throws IOException {
    if (libC.seteuid(euid) != 0) {
      throw new IOException(
          String.format("seteuid(%d) failed, errno = %d", euid, Native.getLastError()));
    }
  }

  @Override
  public void setEffectiveGid(int egid) throws IOException {
    if (libC.setegid(egid) != 0) {
      throw new IOException(
          String.format("setegid(%d) failed, errno = %d", egid, Native.getLastError()));
    }
  }
}
