package com.campusevents.checkin.codec;

public class InvalidTokenFormatException extends RuntimeException {

  public InvalidTokenFormatException(String message) {
    super(message);
  }
}
