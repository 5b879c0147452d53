package com.jentfoo.imagebatch;

/**
 * Invalid run input, detected before any file is touched.
 */
public class ValidationException extends Exception {
  private static final long serialVersionUID = 4660139216541318473L;

  private final String field;

  public ValidationException(String field, String message) {
    super(field + ": " + message);

    this.field = field;
  }

  public String getField() {
    return field;
  }
}
