package com.ospicorp.precorsia.correlation.service;

// An acquisition list, or the buckets both lists share, is empty
public class EmptyInputException extends RuntimeException {

  public EmptyInputException(String message) {
    super(message);
  }
}
