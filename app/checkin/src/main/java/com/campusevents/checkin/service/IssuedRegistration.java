package com.campusevents.checkin.service;

import com.campusevents.checkin.model.RegistrationRecord;

public record IssuedRegistration(RegistrationRecord registration, String artifact) {}
