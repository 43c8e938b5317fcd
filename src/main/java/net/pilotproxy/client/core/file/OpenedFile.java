package net.pilotproxy.client.core.file;

import com.sun.jna.Native;
import com.sun.jna.Platform;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import net.pilotproxy.client.core.ErrorCode;
import net.pilotproxy.client.core.PilotProxyException;
import net.pilotproxy.client.log.PilotLogger;
import net.pilotproxy.client.log.PilotLoggerFactory;

/**
 * A file opened once through the C library without following symbolic links.
 *
 * <p>The channel, the stats and the flock all go through the descriptor path of that single
 * open, so they describe the inode that was opened even if the original path is replaced
 * afterwards.
 */
public final class OpenedFile implements AutoCloseable {
  private static final PilotLogger logger = PilotLoggerFactory.getLogger(OpenedFile.class);

  private static final String DESCRIPTOR_DIR = Platform.isLinux() ? "/proc/self/fd" : "/dev/fd";

  private final Path path;
  private final PosixLibC libC;
  private final int descriptor;
  private final Path descriptorPath;
  private final FileChannel channel;

  private OpenedFile(
      Path path, PosixLibC libC, int descriptor, Path descriptorPath, FileChannel channel) {
    this.path = path;
    this.libC = libC;
    this.descriptor = descriptor;
    this.descriptorPath = descriptorPath;
    this.channel = channel;
  }

  /**
   * @param path file to open for reading
   * @param libC C library binding, null where it could not be loaded
   * @return the opened file
   * @throws PilotProxyException PERMISSION_ERROR for a symbolic link, IO_ERROR otherwise
   */
  static OpenedFile open(Path path, PosixLibC libC) throws PilotProxyException {
    if (libC == null) {
      throw new PilotProxyException(
          ErrorCode.IO_ERROR, path, "the C library is not available on this platform");
    }

    int fd = libC.open(path.toString(), PosixLibC.O_RDONLY | PosixLibC.O_NOFOLLOW);
    if (fd < 0) {
      int errno = Native.getLastError();
      if (Files.isSymbolicLink(path)) {
        throw new PilotProxyException(
            ErrorCode.PERMISSION_ERROR, path, "symbolic link is not allowed");
      }
      logger.warn("Cannot open {}, errno = {}", path, errno);
      throw new PilotProxyException(ErrorCode.IO_ERROR, path, "open failed, errno = " + errno);
    }

    Path descriptorPath = Paths.get(DESCRIPTOR_DIR, Integer.toString(fd));
    try {
      FileChannel channel = FileChannel.open(descriptorPath, StandardOpenOption.READ);
      logger.trace("Opened {} as descriptor {}", path, fd);
      return new OpenedFile(path, libC, fd, descriptorPath, channel);
    } catch (IOException ex) {
      libC.close(fd);
      throw new PilotProxyException(ex, ErrorCode.IO_ERROR, path, ex.getMessage());
    }
  }

  /** @return the path the file was opened by */
  public Path getPath() {
    return path;
  }

  public FileChannel getChannel() {
    return channel;
  }

  /** @return path that resolves to the opened inode, whatever the original path names now */
  public Path getDescriptorPath() {
    return descriptorPath;
  }

  int getDescriptor() {
    return descriptor;
  }

  @Override
  public void close() {
    try {
      channel.close();
    } catch (IOException ex) {
      logger.debug("Failed to close channel of {}: {}", path, ex.getMessage());
    }
    if (libC.close(descriptor) != 0) {
      logger.debug("Failed to close descriptor of {}, errno = {}", path, Native.getLastError());
    }
  }
}
