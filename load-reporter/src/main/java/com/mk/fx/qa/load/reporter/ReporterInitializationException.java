package com.mk.fx.qa.load.reporter;

/** Raised when the reporter cannot be brought up; the run cannot be reported. */
public class ReporterInitializationException extends RuntimeException {

  public ReporterInitializationException(String message) {
    super(message);
  }

  public ReporterInitializationException(String message, Throwable cause) {
    super(message, cause);
  }
}
