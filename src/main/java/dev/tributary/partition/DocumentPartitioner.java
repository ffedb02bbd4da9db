package dev.tributary.partition;

import dev.tributary.document.FileType;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/** Parses one {@link FileType} into an ordered list of blocks. */
public interface DocumentPartitioner {

  FileType fileType();

  /**
   * @param file raw downloaded content
   * @return blocks in document order, without blank ones
   * @throws IOException if the file cannot be read or parsed
   */
  List<PartitionedBlock> partition(Path file) throws IOException;
}
