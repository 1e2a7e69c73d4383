package com.campusevents.checkin.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "checkin.report")
public record CheckInReportProperties(int rowsPerPage) {

  public CheckInReportProperties {
    rowsPerPage = rowsPerPage <= 0 ? 40 : rowsPerPage;
  }
}
