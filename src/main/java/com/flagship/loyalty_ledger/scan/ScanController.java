package com.flagship.loyalty_ledger.scan;

import com.flagship.loyalty_ledger.scan.dto.ScanRequest;
import com.flagship.loyalty_ledger.scan.dto.ScanResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/scans")
@RequiredArgsConstructor
@Slf4j
public class ScanController {

    private final ScanService scanService;

    @PostMapping
    public ResponseEntity<ScanResponse> scan(@Valid @RequestBody ScanRequest request) {
        log.info("Received scan {}: business={}, program={}, points={}",
                request.getScanId(), request.getBusinessId(), request.getProgramId(), request.getPoints());

        ScanResult result = scanService.scan(request.getQrPayload(), request.getBusinessId(),
            request.getProgramId(), request.getPoints(), request.getScanId());
        return ResponseEntity.ok(ScanResponse.from(result));
    }
}
