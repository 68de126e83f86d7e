package com.intermission.scheduler.controller;

import com.intermission.common.model.AdmissionStatus;
import com.intermission.scheduler.core.TriggerResult;
import com.intermission.scheduler.service.AdmissionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Operator and game-facing endpoints. Blocking, manual triggers, zone
 * updates and controller holds all go through here.
 */
@RestController
@RequestMapping("/admission")
@RequiredArgsConstructor
public class AdmissionController {

    private final AdmissionService admissionService;

    @PostMapping("/block")
    public ResponseEntity<Map<String, Object>> block() {
        return ResponseEntity.ok(Map.of("blockCount", admissionService.block()));
    }

    @PostMapping("/unblock")
    public ResponseEntity<Map<String, Object>> unblock() {
        return ResponseEntity.ok(Map.of("blockCount", admissionService.unblock()));
    }

    @PostMapping("/force-reset")
    public ResponseEntity<Map<String, Object>> forceReset() {
        admissionService.forceReset();
        return ResponseEntity.ok(Map.of("blockCount", 0));
    }

    @GetMapping("/blocked")
    public ResponseEntity<Map<String, Object>> blocked() {
        return ResponseEntity.ok(Map.of("blocked", admissionService.isAdmissionBlocked()));
    }

    @PostMapping("/manual-trigger")
    public ResponseEntity<Map<String, Object>> manualTrigger() {
        TriggerResult result = admissionService.requestManualTrigger();
        return ResponseEntity.ok(Map.of("result", result.name()));
    }

    @GetMapping("/manual-trigger/preview")
    public ResponseEntity<Map<String, Object>> previewManualTrigger() {
        return ResponseEntity.ok(Map.of("wouldFire", admissionService.wouldManualTriggerFire()));
    }

    @PostMapping("/rewarded/{rewardId}")
    public ResponseEntity<Map<String, Object>> rewarded(@PathVariable String rewardId) {
        TriggerResult result = admissionService.requestRewarded(rewardId);
        return ResponseEntity.ok(Map.of("result", result.name(), "rewardId", rewardId));
    }

    @PostMapping("/zone/{zoneId}")
    public ResponseEntity<Void> changeZone(@PathVariable String zoneId) {
        admissionService.changeZone(zoneId);
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/initialized")
    public ResponseEntity<Void> initialized() {
        admissionService.markInitialized();
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/controllers/{name}/hold/{holder}")
    public ResponseEntity<Void> holdController(@PathVariable String name, @PathVariable String holder) {
        admissionService.holdController(name, holder);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/controllers/{name}/release/{holder}")
    public ResponseEntity<Map<String, Object>> releaseController(@PathVariable String name,
                                                                 @PathVariable String holder) {
        return ResponseEntity.ok(Map.of("reEnabled", admissionService.releaseController(name, holder)));
    }

    @GetMapping("/status")
    public ResponseEntity<AdmissionStatus> status() {
        return ResponseEntity.ok(admissionService.status());
    }
}
