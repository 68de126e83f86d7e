package com.intermission.scheduler.controller;

import com.intermission.common.model.AdmissionStatus;
import com.intermission.scheduler.core.TriggerResult;
import com.intermission.scheduler.exception.AdmissionUnavailableException;
import com.intermission.scheduler.exception.GlobalExceptionHandler;
import com.intermission.scheduler.service.AdmissionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.Map;

import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class AdmissionControllerTest {

    private AdmissionService service;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        service = mock(AdmissionService.class);
        mvc = MockMvcBuilders.standaloneSetup(new AdmissionController(service))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void blockReturnsCount() throws Exception {
        when(service.block()).thenReturn(1);

        mvc.perform(post("/admission/block"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.blockCount").value(1));
    }

    @Test
    void manualTriggerReportsResult() throws Exception {
        when(service.requestManualTrigger()).thenReturn(TriggerResult.SKIPPED_BY_FREQUENCY);

        mvc.perform(post("/admission/manual-trigger"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result").value("SKIPPED_BY_FREQUENCY"));
    }

    @Test
    void zoneChangeIsAccepted() throws Exception {
        mvc.perform(post("/admission/zone/WORKSHOP"))
                .andExpect(status().isAccepted());

        verify(service).changeZone("WORKSHOP");
    }

    @Test
    void unknownControllerIsBadRequest() throws Exception {
        doThrow(new IllegalArgumentException("Unknown controller: nope"))
                .when(service).holdController("nope", "dialog");

        mvc.perform(post("/admission/controllers/nope/hold/dialog"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("BAD_REQUEST"));
    }

    @Test
    void stalledLoopIsServiceUnavailable() throws Exception {
        when(service.status()).thenThrow(
                new AdmissionUnavailableException("status", "Admission loop did not answer within 2000ms", null));

        mvc.perform(get("/admission/status"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.operation").value("status"));
    }

    @Test
    void statusIsReturned() throws Exception {
        when(service.status()).thenReturn(AdmissionStatus.builder()
                .phase("IDLE")
                .blockCount(0)
                .controllers(Map.of("player-movement", true))
                .build());

        mvc.perform(get("/admission/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.phase").value("IDLE"))
                .andExpect(jsonPath("$.controllers['player-movement']").value(true));
    }
}
