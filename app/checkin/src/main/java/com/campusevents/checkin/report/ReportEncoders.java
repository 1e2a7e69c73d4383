package com.campusevents.checkin.report;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class ReportEncoders {

  private final Map<ReportFormat, ReportEncoder> encoders = new EnumMap<>(ReportFormat.class);

  public ReportEncoders(List<ReportEncoder> encoders) {
    for (ReportEncoder encoder : encoders) {
      if (this.encoders.put(encoder.format(), encoder) != null) {
        throw new IllegalStateException("duplicate report encoder for " + encoder.format());
      }
    }
  }

  public ReportEncoder encoderFor(ReportFormat format) {
    ReportEncoder encoder = encoders.get(format);
    if (encoder == null) {
      throw new IllegalArgumentException("unsupported report format: " + format);
    }
    return encoder;
  }
}
