/*
 * どこで: Check-in API
 * 何を: 受付端末からのスキャンを受け付ける
 * なぜ: 判定結果を常に 200 の本文で返し、端末側の分岐を単純にするため
 */
package com.campusevents.checkin.api;

import com.campusevents.checkin.service.CheckInService;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;

import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
@Validated
public class CheckInController {

    static final String HEADER_DEVICE_ID = "X-Device-Id";

    private final CheckInService checkInService;

    @PostMapping("/check-ins")
    public CheckInResponse checkIn(
            @RequestHeader(HEADER_DEVICE_ID)
            @NotBlank(message = "X-Device-Id is required")
            @Size(max = 128, message = "X-Device-Id must be at most 128 characters")
            String deviceId,
            @Valid @RequestBody CheckInRequest request) {
        return CheckInResponse.from(checkInService.attemptCheckIn(request.artifact(), deviceId));
    }
}
