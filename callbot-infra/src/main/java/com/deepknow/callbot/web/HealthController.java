package com.deepknow.callbot.web;

import com.deepknow.callbot.domain.bridge.service.AudioBridgeService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final AudioBridgeService audioBridgeService;

    public HealthController(AudioBridgeService audioBridgeService) {
        this.audioBridgeService = audioBridgeService;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("service", "callbot");
        body.put("activeBridges", audioBridgeService.activeCount());
        return body;
    }
}
