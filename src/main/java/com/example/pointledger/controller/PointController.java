package com.example.pointledger.controller;

import com.example.pointledger.facade.PointFacade;
import com.example.pointledger.facade.dto.GetBalanceResponse;
import com.example.pointledger.facade.dto.GrantPointsRequest;
import com.example.pointledger.facade.dto.PointBatchDto;
import com.example.pointledger.facade.dto.UpcomingExpirationsResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequestMapping("/points")
@RequiredArgsConstructor
@Validated
public class PointController {

    private final PointFacade pointFacade;

    @PostMapping("/grants")
    public ResponseEntity<PointBatchDto> grantPoints(@Valid @RequestBody GrantPointsRequest request) {
        log.info("POST /points/grants - userId={}, amount={}, expiresAt={}",
                request.getUserId(), request.getAmount(), request.getExpiresAt());

        PointBatchDto response = pointFacade.grantPoints(request);

        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/{userId}/balance")
    public ResponseEntity<GetBalanceResponse> getBalance(
            @PathVariable
            @NotBlank(message = "UserId cannot be null or blank")
            @Size(min = 3, max = 50, message = "UserId length must be between 3 and 50 characters")
            String userId) {
        log.info("GET /points/{}/balance", userId);

        return ResponseEntity.ok(pointFacade.getBalance(userId));
    }

    @GetMapping("/{userId}/expirations")
    public ResponseEntity<UpcomingExpirationsResponse> getUpcomingExpirations(
            @PathVariable
            @NotBlank(message = "UserId cannot be null or blank")
            @Size(min = 3, max = 50, message = "UserId length must be between 3 and 50 characters")
            String userId) {
        log.info("GET /points/{}/expirations", userId);

        return ResponseEntity.ok(pointFacade.getUpcomingExpirations(userId));
    }
}
