package com.alpaca.flowdesk.controller;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class HealthController {

    @GetMapping(value = "/", produces = MediaType.TEXT_HTML_VALUE)
    public String home() { return "<h3>Trading bot service is up ✅</h3>"; }

    @GetMapping("/health")
    public Map<String, String> health() { return Map.of("status", "ok"); }
}
