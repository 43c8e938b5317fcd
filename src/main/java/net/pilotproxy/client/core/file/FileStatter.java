package net.pilotproxy.client.core.file;

import java.io.IOException;
import java.nio.file.Path;

/** Source of {@link FileSnapshot}s. */
@FunctionalInterface
public interface FileStatter {
  FileSnapshot stat(Path path) throws IOException;
}
