package com.elssolution.tuyaexporter.web;

import com.elssolution.tuyaexporter.service.StatusService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
public class StatusController {

    private final StatusService status;

    public StatusController(StatusService status) {
        this.status = status;
    }

    @GetMapping("/status")
    public List<StatusService.DeviceView> getStatus() {
        return status.buildStatusView();
    }
}
