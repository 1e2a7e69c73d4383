package com.campusevents.checkin.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

/** 本文は省略可能。check_in_closes_at を省くと受付期限なしで発行する。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record IssueRegistrationRequest(Instant checkInClosesAt) {}
