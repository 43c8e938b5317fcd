package net.pilotproxy.client.core.file;

import com.sun.jna.Library;
import com.sun.jna.Native;
import com.sun.jna.Platform;

/** JNA interface for the parts of the C standard library (libc) used for identity and flock. */
interface PosixLibC extends Library {

  int O_RDONLY = 0;

  int O_NOFOLLOW =
      Platform.isMac() || Platform.isFreeBSD() || Platform.isOpenBSD() || Platform.isNetBSD()
          ? 0x100
          : Platform.isARM() || Platform.isPPC() ? 0x8000 : 0x20000;

  int LOCK_SH = 1;
  int LOCK_EX = 2;
  int LOCK_UN = 8;

  int EINTR = 4;

  PosixLibC INSTANCE = loadLibC();

  int getuid();

  int geteuid();

  int getgid();

  int getegid();

  int seteuid(int euid);

  int setegid(int egid);

  int open(String path, int flags);

  int close(int fd);

  int flock(int fd, int operation);

  static PosixLibC loadLibC() {
    if (Platform.isWindows()) {
      return null;
    }
    try {
      return Native.load(Platform.C_LIBRARY_NAME, PosixLibC.class);
    } catch (Throwable t) {
      return null;
    }
  }
}
