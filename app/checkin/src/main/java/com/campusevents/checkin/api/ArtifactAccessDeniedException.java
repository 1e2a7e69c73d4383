package com.campusevents.checkin.api;

public class ArtifactAccessDeniedException extends RuntimeException {

  public ArtifactAccessDeniedException(String message) {
    super(message);
  }
}
