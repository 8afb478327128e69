package com.elssolution.tuyaexporter.web;

import com.elssolution.tuyaexporter.service.MetricExporter;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** Prometheus scrape endpoint. Always 200: fetch problems show up as growing data age. */
@RestController
public class MetricsController {

    private final MetricExporter exporter;

    public MetricsController(MetricExporter exporter) {
        this.exporter = exporter;
    }

    @GetMapping("/metrics")
    public ResponseEntity<String> metrics() {
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_TYPE, exporter.contentType())
                .body(exporter.render());
    }
}
