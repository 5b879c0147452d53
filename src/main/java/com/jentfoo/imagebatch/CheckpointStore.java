package com.jentfoo.imagebatch;

import java.io.IOException;

public interface CheckpointStore {
  /**
   * Replaces any stored snapshot with the given state.
   */
  public void save(SessionState state) throws IOException;

  /**
   * @return the most recent snapshot, or {@code null} when there is no session to resume
   */
  public SessionState load() throws IOException;

  public void clear() throws IOException;
}
