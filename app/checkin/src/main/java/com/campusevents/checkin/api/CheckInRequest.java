package com.campusevents.checkin.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;

/** artifact はスキャナの読み取り値をそのまま渡す。空文字も判定対象として受け付ける。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CheckInRequest(@NotNull(message = "artifact is required") String artifact) {}
