package com.trackradar.radar.controller;

import com.trackradar.radar.dto.request.FixRequest;
import com.trackradar.radar.dto.request.PreferencesRequest;
import com.trackradar.radar.dto.request.RouteStartRequest;
import com.trackradar.radar.dto.response.FixResponse;
import com.trackradar.radar.dto.response.PreferencesResponse;
import com.trackradar.radar.dto.response.RadarInfoResponse;
import com.trackradar.radar.dto.response.SessionResponse;
import com.trackradar.radar.service.RadarSessionService;
import com.trackradar.radar.service.alarm.AlarmRecord;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Tag(name = "트랙 레이더", description = "경로 이탈 / GPS 신호 감시 세션 API")
@RestController
@RequestMapping("/api/radar")
@RequiredArgsConstructor
public class RadarController {

    private final RadarSessionService sessionService;

    /**
     * POST /api/radar/session
     * - 파싱된 경로 좌표로 세션 시작 (기존 세션은 종료)
     */
    @Operation(
            summary = "세션 시작",
            description = "구간별 좌표 목록으로 경로를 등록하고 감시를 시작합니다. 진행 중인 세션은 종료됩니다."
    )
    @PostMapping(value = "/session", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<SessionResponse> start(@Valid @RequestBody RouteStartRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED).body(sessionService.start(req));
    }

    @Operation(summary = "세션 종료")
    @DeleteMapping("/session")
    public ResponseEntity<Void> stop() {
        sessionService.stop();
        return ResponseEntity.noContent().build();
    }

    /**
     * POST /api/radar/session/fixes
     * - 위치 업링크 → 경로까지 부호 있는 거리 응답
     */
    @Operation(
            summary = "위치 업로드",
            description = "현재 위치/정확도를 업로드하면 경로까지의 거리(0 이하 = 경로 위)와 신호 상태를 응답합니다."
    )
    @PostMapping("/session/fixes")
    public FixResponse ingest(@Valid @RequestBody FixRequest req) {
        return sessionService.ingest(req);
    }

    @Operation(
            summary = "상태 조회",
            description = "신호가 있으면 마지막 거리, 없으면 '신호 없음' 안내를 응답합니다."
    )
    @GetMapping("/session/info")
    public RadarInfoResponse info() {
        return sessionService.info();
    }

    @Operation(summary = "최근 알람 조회", description = "최근 발생한 알람을 최신 순으로 응답합니다.")
    @GetMapping("/alarms")
    public List<AlarmRecord> alarms() {
        return sessionService.recentAlarms();
    }

    @Operation(summary = "설정 조회")
    @GetMapping("/preferences")
    public PreferencesResponse preferences() {
        return PreferencesResponse.from(sessionService.currentPreferences());
    }

    /**
     * PUT /api/radar/preferences
     * - 진행 중인 세션에도 다음 fix / 다음 점검부터 바로 반영된다
     */
    @Operation(summary = "설정 변경", description = "알람 거리/간격/출력 설정을 교체합니다.")
    @PutMapping("/preferences")
    public PreferencesResponse updatePreferences(@Valid @RequestBody PreferencesRequest req) {
        return PreferencesResponse.from(sessionService.updatePreferences(req));
    }
}
