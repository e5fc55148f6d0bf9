package com.di.sqlpulse.api;

import com.di.sqlpulse.collection.RetentionReport;
import com.di.sqlpulse.collection.RetentionService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/monitoring/retention")
@RequiredArgsConstructor
public class RetentionController {

    private final RetentionService retentionService;

    @PostMapping("/cleanup")
    public RetentionReport cleanup() {
        return retentionService.cleanup();
    }
}
