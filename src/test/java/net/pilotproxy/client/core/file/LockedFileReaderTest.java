package net.pilotproxy.client.core.file;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.concurrent.atomic.AtomicInteger;
import net.pilotproxy.client.annotations.DontRunOnWindows;
import net.pilotproxy.client.category.TestTags;
import net.pilotproxy.client.core.ErrorCode;
import net.pilotproxy.client.core.PilotProxyException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;
import org.mockito.InOrder;

@Tag(TestTags.FILE)
@DontRunOnWindows
class LockedFileReaderTest {
  private static final byte[] PROXY_CONTENT =
      "-----BEGIN CERTIFICATE-----\nMIIB\n-----END CERTIFICATE-----\n"
          .getBytes(StandardCharsets.US_ASCII);

  @TempDir Path tempDir;

  private Path proxyFile;
  private int ownerUid;
  private PosixIdentity identity;

  @BeforeEach
  void setUp() throws IOException {
    proxyFile = createFile("x509up_u1000", PROXY_CONTENT, "rw-------");
    ownerUid = (Integer) Files.getAttribute(proxyFile, "unix:uid");
    identity = identityOf(ownerUid);
  }

  @ParameterizedTest
  @EnumSource(LockType.class)
  void shouldReadOwnerOnlyFileWithEveryLockType(LockType lockType) throws Exception {
    byte[] content = new LockedFileReader(identity).read(proxyFile, lockType);

    assertArrayEquals(PROXY_CONTENT, content);
  }

  @Test
  void shouldReadEmptyFile() throws Exception {
    Path empty = createFile("empty", new byte[0], "rw-------");

    assertEquals(0, new LockedFileReader(identity).read(empty, LockType.NONE).length);
  }

  @ParameterizedTest
  @CsvSource({
    "rw-------,true",
    "r--------,true",
    "rwx------,true",
    "rw-r-----,false",
    "rw--w----,false",
    "rw----r--,false",
    "rw-----w-,false",
    "rw-rw-rw-,false",
    "rw---x---,true",
    "rw------x,true"
  })
  void shouldEnforceOwnerOnlyAccess(String permissions, boolean isSucceed) throws Exception {
    Files.setPosixFilePermissions(proxyFile, PosixFilePermissions.fromString(permissions));
    LockedFileReader reader = new LockedFileReader(identity);

    if (isSucceed) {
      assertArrayEquals(PROXY_CONTENT, reader.read(proxyFile, LockType.NONE));
    } else {
      PilotProxyException ex =
          assertThrows(PilotProxyException.class, () -> reader.read(proxyFile, LockType.NONE));
      assertEquals(ErrorCode.PERMISSION_ERROR, ex.getErrorCode());
      assertTrue(ex.getMessage().contains(proxyFile.toString()));
      assertTrue(ex.getMessage().contains("wider than allowed"));
    }
  }

  @Test
  void shouldRejectFileOwnedBySomeoneElse() {
    LockedFileReader reader = new LockedFileReader(identityOf(ownerUid + 1));

    PilotProxyException ex =
        assertThrows(PilotProxyException.class, () -> reader.read(proxyFile, LockType.NONE));
    assertEquals(ErrorCode.PERMISSION_ERROR, ex.getErrorCode());
    assertTrue(ex.getMessage().contains("owner"));
  }

  @Test
  void shouldRejectSymbolicLink() throws IOException {
    Path link = Files.createSymbolicLink(tempDir.resolve("link"), proxyFile);
    LockedFileReader reader = new LockedFileReader(identity);

    PilotProxyException ex =
        assertThrows(PilotProxyException.class, () -> reader.read(link, LockType.NONE));
    assertEquals(ErrorCode.PERMISSION_ERROR, ex.getErrorCode());
  }

  @Test
  void shouldRejectWhatIsNotARegularFile() {
    FileStatter statter =
        path -> {
          FileSnapshot real = new PosixFileStatter().stat(path);
          return new FileSnapshot(
              real.getSize(),
              real.getLastModifiedTime(),
              real.getChangeTime(),
              real.getFileKey(),
              real.getOwnerUid(),
              real.getPermissions(),
              false);
        };
    LockedFileReader reader = new LockedFileReader(identity, statter, ReadRetryPolicy.DEFAULT);

    PilotProxyException ex =
        assertThrows(PilotProxyException.class, () -> reader.read(proxyFile, LockType.NONE));
    assertEquals(ErrorCode.PERMISSION_ERROR, ex.getErrorCode());
  }

  @Test
  void shouldFailForMissingFile() {
    LockedFileReader reader = new LockedFileReader(identity);

    PilotProxyException ex =
        assertThrows(
            PilotProxyException.class,
            () -> reader.read(tempDir.resolve("missing"), LockType.RANGE));
    assertEquals(ErrorCode.IO_ERROR, ex.getErrorCode());
  }

  @Test
  void shouldRereadFileRewrittenDuringRead() throws Exception {
    byte[] rewritten =
        "-----BEGIN CERTIFICATE-----\nMIIBrewritten\n-----END CERTIFICATE-----\n"
            .getBytes(StandardCharsets.US_ASCII);
    AtomicInteger stats = new AtomicInteger();
    FileStatter statter =
        path -> {
          if (stats.incrementAndGet() == 2) {
            Files.write(proxyFile, rewritten);
          }
          return new PosixFileStatter().stat(path);
        };
    LockedFileReader reader =
        new LockedFileReader(identity, statter, new ReadRetryPolicy(10, 0));

    byte[] content = reader.read(proxyFile, LockType.NONE);

    assertArrayEquals(rewritten, content);
    assertEquals(3, stats.get());
  }

  @Test
  void shouldGiveUpWhenFileKeepsChanging() {
    AtomicInteger stats = new AtomicInteger();
    FileStatter statter =
        path -> {
          FileSnapshot real = new PosixFileStatter().stat(path);
          return new FileSnapshot(
              real.getSize(),
              FileTime.fromMillis(stats.incrementAndGet()),
              real.getChangeTime(),
              real.getFileKey(),
              real.getOwnerUid(),
              real.getPermissions(),
              true);
        };
    LockedFileReader reader = new LockedFileReader(identity, statter, new ReadRetryPolicy(3, 0));

    PilotProxyException ex =
        assertThrows(PilotProxyException.class, () -> reader.read(proxyFile, LockType.NONE));
    assertEquals(ErrorCode.TOO_MANY_RETRIES, ex.getErrorCode());
    assertEquals(4, stats.get());
  }

  @Test
  void shouldFailOnShortReadOfUnchangedFile() {
    FileStatter statter =
        path -> {
          FileSnapshot real = new PosixFileStatter().stat(path);
          return new FileSnapshot(
              real.getSize() + 10,
              real.getLastModifiedTime(),
              real.getChangeTime(),
              real.getFileKey(),
              real.getOwnerUid(),
              real.getPermissions(),
              true);
        };
    LockedFileReader reader = new LockedFileReader(identity, statter, ReadRetryPolicy.DEFAULT);

    PilotProxyException ex =
        assertThrows(PilotProxyException.class, () -> reader.read(proxyFile, LockType.NONE));
    assertEquals(ErrorCode.IO_ERROR, ex.getErrorCode());
  }

  @Test
  void shouldRefuseSizeBeyondArrayLimit() {
    FileStatter statter =
        path -> {
          FileSnapshot real = new PosixFileStatter().stat(path);
          return new FileSnapshot(
              Long.MAX_VALUE,
              real.getLastModifiedTime(),
              real.getChangeTime(),
              real.getFileKey(),
              real.getOwnerUid(),
              real.getPermissions(),
              true);
        };
    LockedFileReader reader = new LockedFileReader(identity, statter, ReadRetryPolicy.DEFAULT);

    PilotProxyException ex =
        assertThrows(PilotProxyException.class, () -> reader.read(proxyFile, LockType.NONE));
    assertEquals(ErrorCode.OUT_OF_MEMORY, ex.getErrorCode());
  }

  @Test
  void shouldRestoreInterruptFlagWhenInterruptedWhileWaiting() {
    AtomicInteger stats = new AtomicInteger();
    FileStatter statter =
        path -> {
          FileSnapshot real = new PosixFileStatter().stat(path);
          if (stats.incrementAndGet() == 2) {
            Thread.currentThread().interrupt();
          }
          return new FileSnapshot(
              real.getSize(),
              FileTime.fromMillis(stats.get()),
              real.getChangeTime(),
              real.getFileKey(),
              real.getOwnerUid(),
              real.getPermissions(),
              true);
        };
    LockedFileReader reader =
        new LockedFileReader(identity, statter, new ReadRetryPolicy(10, 1000));

    try {
      PilotProxyException ex =
          assertThrows(PilotProxyException.class, () -> reader.read(proxyFile, LockType.NONE));
      assertEquals(ErrorCode.IO_ERROR, ex.getErrorCode());
      assertTrue(Thread.currentThread().isInterrupted());
    } finally {
      Thread.interrupted();
    }
  }

  @Test
  void shouldCheckOpenedFileWhenPathIsReplacedAfterOpen() throws Exception {
    Path unsafe =
        createFile("unsafe", "WORLD-WRITABLE".getBytes(StandardCharsets.US_ASCII), "rw-rw-rw-");
    Path safe = createFile("safe", PROXY_CONTENT, "rw-------");
    FileLocker swappingLocker =
        (file, mode) -> {
          moveOver(safe, unsafe);
          return () -> {};
        };
    LockedFileReader reader = new LockedFileReader(identity);

    PilotProxyException ex =
        assertThrows(PilotProxyException.class, () -> reader.read(unsafe, swappingLocker));
    assertEquals(ErrorCode.PERMISSION_ERROR, ex.getErrorCode());
  }

  @Test
  void shouldReturnContentOfOpenedFileWhenPathIsReplacedAfterOpen() throws Exception {
    Path other =
        createFile("other", "REPLACEMENT".getBytes(StandardCharsets.US_ASCII), "rw-r--r--");
    FileLocker swappingLocker =
        (file, mode) -> {
          moveOver(other, proxyFile);
          return () -> {};
        };

    byte[] content = new LockedFileReader(identity).read(proxyFile, swappingLocker);

    assertArrayEquals(PROXY_CONTENT, content);
  }

  @Test
  void shouldRestorePrivilegeAfterFailedReadAsRoot() throws Exception {
    PosixIdentity root = mock(PosixIdentity.class);
    when(root.getRealUid()).thenReturn(1000);
    when(root.getRealGid()).thenReturn(100);
    when(root.getEffectiveUid()).thenReturn(0);
    when(root.getEffectiveGid()).thenReturn(0);
    LockedFileReader reader = new LockedFileReader(root);

    assertThrows(
        PilotProxyException.class, () -> reader.read(tempDir.resolve("missing"), LockType.NONE));

    InOrder inOrder = inOrder(root);
    inOrder.verify(root).setEffectiveGid(100);
    inOrder.verify(root).setEffectiveUid(1000);
    inOrder.verify(root).setEffectiveUid(0);
    inOrder.verify(root).setEffectiveGid(0);
  }

  private Path createFile(String name, byte[] content, String permissions) throws IOException {
    Path file = tempDir.resolve(name);
    Files.write(file, content);
    Files.setPosixFilePermissions(file, PosixFilePermissions.fromString(permissions));
    return file;
  }

  private static void moveOver(Path source, Path target) {
    try {
      Files.move(
          source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
  }

  private static PosixIdentity identityOf(int uid) {
    PosixIdentity identity = mock(PosixIdentity.class);
    when(identity.getRealUid()).thenReturn(uid);
    when(identity.getEffectiveUid()).thenReturn(uid);
    return identity;
  }
}
