package net.pilotproxy.client.core.file;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import java.io.IOException;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import net.pilotproxy.client.annotations.DontRunOnWindows;
import net.pilotproxy.client.annotations.RunOnLinux;
import net.pilotproxy.client.category.TestTags;
import net.pilotproxy.client.core.ErrorCode;
import net.pilotproxy.client.core.PilotProxyException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@Tag(TestTags.FILE)
@DontRunOnWindows
class FileLockerTest {
  private static final int LOCK_NB = 4;

  @TempDir Path tempDir;

  private Path file;
  private PosixLibC libC;

  @BeforeEach
  void setUp() throws IOException {
    libC = PosixLibC.INSTANCE;
    assumeTrue(libC != null, "C library is not available");
    file = Files.write(tempDir.resolve("locked"), new byte[] {1, 2, 3});
  }

  @Nested
  class OpenTests {
    @Test
    void shouldRejectSymbolicLink() throws IOException {
      Path link = Files.createSymbolicLink(tempDir.resolve("link"), file);

      PilotProxyException ex =
          assertThrows(PilotProxyException.class, () -> OpenedFile.open(link, libC));
      assertEquals(ErrorCode.PERMISSION_ERROR, ex.getErrorCode());
    }

    @Test
    void shouldReportIoErrorForMissingFile() {
      PilotProxyException ex =
          assertThrows(
              PilotProxyException.class, () -> OpenedFile.open(tempDir.resolve("missing"), libC));
      assertEquals(ErrorCode.IO_ERROR, ex.getErrorCode());
    }

    @Test
    void shouldReportIoErrorWithoutCLibrary() {
      PilotProxyException ex =
          assertThrows(PilotProxyException.class, () -> OpenedFile.open(file, null));
      assertEquals(ErrorCode.IO_ERROR, ex.getErrorCode());
    }

    @Test
    @RunOnLinux
    void shouldKeepDescribingOpenedInodeAfterPathIsReplaced() throws Exception {
      Path replacement = Files.write(tempDir.resolve("replacement"), new byte[] {9, 9, 9, 9, 9});
      try (OpenedFile opened = OpenedFile.open(file, libC)) {
        Object openedKey = new PosixFileStatter().stat(opened.getDescriptorPath()).getFileKey();
        Files.move(replacement, file, StandardCopyOption.REPLACE_EXISTING);

        FileSnapshot snapshot = new PosixFileStatter().stat(opened.getDescriptorPath());
        assertEquals(openedKey, snapshot.getFileKey());
        assertEquals(3, snapshot.getSize());
        assertNotEquals(openedKey, new PosixFileStatter().stat(file).getFileKey());
      }
    }
  }

  @Nested
  class RangeLockTests {
    @Test
    void shouldHoldSharedLockUntilClosed() throws Exception {
      try (OpenedFile opened = OpenedFile.open(file, libC)) {
        AcquiredLock lock = new RangeFileLocker().lock(opened, LockMode.SHARED);
        assertThrows(
            OverlappingFileLockException.class,
            () -> opened.getChannel().tryLock(0L, Long.MAX_VALUE, true));

        lock.close();

        FileLock again = opened.getChannel().tryLock(0L, Long.MAX_VALUE, true);
        assertNotNull(again);
        again.release();
      }
    }

    @Test
    void shouldReportLockErrorForExclusiveLockOnReadOnlyChannel() throws Exception {
      try (OpenedFile opened = OpenedFile.open(file, libC)) {
        PilotProxyException ex =
            assertThrows(
                PilotProxyException.class,
                () -> new RangeFileLocker().lock(opened, LockMode.EXCLUSIVE));
        assertEquals(ErrorCode.LOCK_ERROR, ex.getErrorCode());
      }
    }
  }

  @Nested
  class FlagLockTests {
    @Test
    @RunOnLinux
    void shouldExcludeOtherDescriptorsWhileHeld() throws Exception {
      try (OpenedFile opened = OpenedFile.open(file, libC)) {
        AcquiredLock lock = new FlagFileLocker(libC).lock(opened, LockMode.EXCLUSIVE);
        int fd = libC.open(file.toString(), PosixLibC.O_RDONLY);
        try {
          assertNotEquals(0, libC.flock(fd, PosixLibC.LOCK_SH | LOCK_NB));
          lock.close();
          assertEquals(0, libC.flock(fd, PosixLibC.LOCK_SH | LOCK_NB));
        } finally {
          libC.flock(fd, PosixLibC.LOCK_UN);
          libC.close(fd);
        }
      }
    }

    @Test
    @RunOnLinux
    void shouldLockOpenedInodeEvenAfterPathIsReplaced() throws Exception {
      int originalFd = libC.open(file.toString(), PosixLibC.O_RDONLY);
      assertTrue(originalFd >= 0);
      try (OpenedFile opened = OpenedFile.open(file, libC)) {
        Path replacement = Files.write(tempDir.resolve("replacement"), new byte[] {4});
        Files.move(replacement, file, StandardCopyOption.REPLACE_EXISTING);

        try (AcquiredLock ignored = new FlagFileLocker(libC).lock(opened, LockMode.EXCLUSIVE)) {
          assertNotEquals(0, libC.flock(originalFd, PosixLibC.LOCK_SH | LOCK_NB));

          int replacementFd = libC.open(file.toString(), PosixLibC.O_RDONLY);
          try {
            assertEquals(0, libC.flock(replacementFd, PosixLibC.LOCK_SH | LOCK_NB));
          } finally {
            libC.flock(replacementFd, PosixLibC.LOCK_UN);
            libC.close(replacementFd);
          }
        }
      } finally {
        libC.flock(originalFd, PosixLibC.LOCK_UN);
        libC.close(originalFd);
      }
    }

    @Test
    void shouldReportLockErrorWithoutCLibrary() throws Exception {
      try (OpenedFile opened = OpenedFile.open(file, libC)) {
        PilotProxyException ex =
            assertThrows(
                PilotProxyException.class,
                () -> new FlagFileLocker(null).lock(opened, LockMode.SHARED));
        assertEquals(ErrorCode.LOCK_ERROR, ex.getErrorCode());
      }
    }
  }
}
