package com.trackradar.radar.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trackradar.radar.config.RadarProperties;
import com.trackradar.radar.dto.request.FixRequest;
import com.trackradar.radar.dto.request.GeoPointRequest;
import com.trackradar.radar.dto.request.PreferencesRequest;
import com.trackradar.radar.dto.request.RouteStartRequest;
import com.trackradar.radar.service.RadarPreferences;
import com.trackradar.radar.service.RadarPreferencesHolder;
import com.trackradar.radar.service.RadarSessionService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.util.List;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class RadarControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private RadarSessionService sessionService;

    @Autowired
    private RadarPreferencesHolder preferencesHolder;

    @Autowired
    private RadarProperties radarProperties;

    @AfterEach
    void tearDown() {
        sessionService.shutdown();
        preferencesHolder.replace(RadarPreferences.from(radarProperties));
    }

    private ResultActions startSession() throws Exception {
        RouteStartRequest route = new RouteStartRequest(List.of(
                List.of(new GeoPointRequest(52.0, 21.0), new GeoPointRequest(52.005, 21.0), new GeoPointRequest(52.01, 21.0)),
                List.of(new GeoPointRequest(52.01, 21.0), new GeoPointRequest(52.01, 21.01))));
        return mockMvc.perform(post("/api/radar/session")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(route)));
    }

    private ResultActions postFix(double lat, double lon, Double accuracy) throws Exception {
        return mockMvc.perform(post("/api/radar/session/fixes")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new FixRequest(lat, lon, accuracy))));
    }

    @Test
    void shouldStartSession() throws Exception {
        startSession()
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.sessionId").exists())
                .andExpect(jsonPath("$.segments").value(2))
                .andExpect(jsonPath("$.points").value(5));
    }

    @Test
    void shouldReportNoSignalBeforeFirstFix() throws Exception {
        startSession().andExpect(status().isCreated());

        mockMvc.perform(get("/api/radar/session/info"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("NO_SIGNAL"))
                .andExpect(jsonPath("$.message").value(RadarSessionService.NO_SIGNAL_TEXT))
                .andExpect(jsonPath("$.signedDistanceM").doesNotExist());
    }

    @Test
    void shouldEvaluateOnTrackFix() throws Exception {
        startSession().andExpect(status().isCreated());

        postFix(52.003, 21.0, 5.0)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.onTrack").value(true))
                .andExpect(jsonPath("$.hasSignal").value(true));

        mockMvc.perform(get("/api/radar/session/info"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("SIGNAL"))
                .andExpect(jsonPath("$.evaluatedFixes").value(1));

        mockMvc.perform(get("/api/radar/alarms"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].kind").value("POSITIVE_ACKNOWLEDGEMENT"));
    }

    @Test
    void shouldEvaluateOffTrackFix() throws Exception {
        startSession().andExpect(status().isCreated());

        postFix(52.003, 21.02, null)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.onTrack").value(false))
                .andExpect(jsonPath("$.signedDistanceM").isNumber());
    }

    @Test
    void shouldRejectInvalidFix() throws Exception {
        startSession().andExpect(status().isCreated());

        postFix(120.0, 21.0, 5.0)
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
    }

    @Test
    void shouldRejectEmptyRoute() throws Exception {
        mockMvc.perform(post("/api/radar/session")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"segments\":[]}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void shouldReturnConflictWithoutSession() throws Exception {
        mockMvc.perform(get("/api/radar/session/info"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("INVALID_STATE"));

        postFix(52.0, 21.0, 0.0).andExpect(status().isConflict());
        mockMvc.perform(delete("/api/radar/session")).andExpect(status().isConflict());
    }

    @Test
    void shouldStopSession() throws Exception {
        startSession().andExpect(status().isCreated());

        mockMvc.perform(delete("/api/radar/session")).andExpect(status().isNoContent());
        mockMvc.perform(get("/api/radar/session/info")).andExpect(status().isConflict());
    }

    @Test
    void shouldReplacePreferences() throws Exception {
        mockMvc.perform(get("/api/radar/preferences"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.offTrackAlarmDistanceM").value(50.0))
                .andExpect(jsonPath("$.noGpsAlarmFirstTimeoutSec").value(5));

        PreferencesRequest update = new PreferencesRequest(2000.0, 20, 15, 60, false, true, false, true);
        mockMvc.perform(put("/api/radar/preferences")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(update)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.offTrackAlarmDistanceM").value(2000.0))
                .andExpect(jsonPath("$.noGpsAlarmAgainIntervalSec").value(60));

        // 새 임계 거리가 진행 중인 세션에 바로 반영된다
        startSession().andExpect(status().isCreated());
        postFix(52.003, 21.02, null).andExpect(jsonPath("$.onTrack").value(true));
    }

    @Test
    void shouldRejectInvalidPreferences() throws Exception {
        PreferencesRequest invalid = new PreferencesRequest(50.0, 10, 0, 30, true, true, true, true);

        mockMvc.perform(put("/api/radar/preferences")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(invalid)))
                .andExpect(status().isBadRequest());
    }

    @Test
    void shouldKeepSpringStatusForUnknownPathAndMethod() throws Exception {
        mockMvc.perform(get("/api/radar/unknown"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("404"));

        mockMvc.perform(delete("/api/radar/preferences"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(jsonPath("$.error").value("405"));
    }

    @Test
    void shouldServeApiDocsWithoutAuthentication() throws Exception {
        mockMvc.perform(get("/v3/api-docs"))
                .andExpect(status().isOk());
    }
}
