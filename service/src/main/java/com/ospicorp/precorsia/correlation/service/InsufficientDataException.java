package com.ospicorp.precorsia.correlation.service;

public class InsufficientDataException extends RuntimeException {
  private final int required;
  private final int available;

  public InsufficientDataException(String message, int required, int available) {
    super(message + " (required " + required + ", available " + available + ")");
    this.required = required;
    this.available = available;
  }

  public int required() {
    return required;
  }

  public int available() {
    return available;
  }
}
