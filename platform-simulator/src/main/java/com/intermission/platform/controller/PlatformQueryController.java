package com.intermission.platform.controller;

import com.intermission.platform.model.DisplayState;
import com.intermission.platform.service.DisplayStateStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only endpoint to check what the simulated platform is showing.
 */
@RestController
@RequestMapping("/platform")
@RequiredArgsConstructor
public class PlatformQueryController {

    private final DisplayStateStore store;

    @GetMapping("/state")
    public ResponseEntity<DisplayState> state() {
        return ResponseEntity.ok(store.snapshot());
    }
}
