package com.github.flowgraph;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * This object encapsulates the result of a save, load or compile operation.
 * 
 * Successes are encoded with {@link #isSuccessful()} being true. Failures report false and carry
 * an associated {@link #getError()}. Because compilation is not transactional, a failed result
 * may still list files in {@link #getWrittenFiles()} that were written before the failure.
 */
public final class FlowIoResult {
  private final String description;
  private final FlowGraphException error;
  private final boolean successful;
  private final List<Path> writtenFiles;

  public FlowIoResult(final boolean successful, final String description,
      final FlowGraphException error, final List<Path> writtenFiles) {
    this.successful = successful;
    this.description = description;
    this.error = error;
    this.writtenFiles = writtenFiles == null ? Collections.<Path>emptyList()
        : Collections.unmodifiableList(new ArrayList<>(writtenFiles));
  }

  static FlowIoResult success(final String description, final List<Path> writtenFiles) {
    return new FlowIoResult(true, description, null, writtenFiles);
  }

  static FlowIoResult failure(final FlowGraphException error, final List<Path> writtenFiles) {
    return new FlowIoResult(false, error.getMessage(), error, writtenFiles);
  }

  public String getDescription() {
    return description;
  }

  public FlowGraphException getError() {
    return error;
  }

  public boolean isSuccessful() {
    return successful;
  }

  public List<Path> getWrittenFiles() {
    return writtenFiles;
  }

  @Override
  public String toString() {
    return "FlowIoResult [description=" + description + ", error=" + error + ", successful="
        + successful + ", writtenFiles=" + writtenFiles + "]";
  }
}
