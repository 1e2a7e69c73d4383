package com.campusevents.checkin.api;

public class RegistrationNotFoundException extends RuntimeException {

  public RegistrationNotFoundException(String message) {
    super(message);
  }
}
