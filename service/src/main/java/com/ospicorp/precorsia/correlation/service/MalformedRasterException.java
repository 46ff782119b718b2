package com.ospicorp.precorsia.correlation.service;

public class MalformedRasterException extends RuntimeException {

  public MalformedRasterException(String message) {
    super(message);
  }

  public MalformedRasterException(String message, Throwable cause) {
    super(message, cause);
  }
}
