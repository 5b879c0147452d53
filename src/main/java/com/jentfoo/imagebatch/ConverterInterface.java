package com.jentfoo.imagebatch;

public interface ConverterInterface {
  /**
   * Runs the job to completion.  Per file problems are captured in the returned result rather 
   * than thrown.
   */
  public ConversionResult convert(Job job);
}
