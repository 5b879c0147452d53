package com.jentfoo.imagebatch;

/**
 * Failure of one step while converting a single file.  The message names the step that failed 
 * so failures can be grouped in the final report.
 */
public class ConversionException extends Exception {
  private static final long serialVersionUID = -3071349235185743712L;

  public ConversionException(String step, Throwable cause) {
    super(step + ": " + describe(cause), cause);
  }

  public ConversionException(String message) {
    super(message);
  }

  private static String describe(Throwable t) {
    if (t.getMessage() == null) {
      return t.getClass().getSimpleName();
    } else {
      return t.getMessage();
    }
  }
}
