package com.jentfoo.imagebatch;

public class CancellationSignal {
  private volatile boolean cancelled = false;

  public void cancel() {
    cancelled = true;
  }

  public boolean isCancelled() {
    return cancelled;
  }
}
