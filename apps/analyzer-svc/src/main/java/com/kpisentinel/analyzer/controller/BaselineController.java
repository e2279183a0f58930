package com.kpisentinel.analyzer.controller;

import com.kpisentinel.analyzer.controller.dto.BaselineResponseDto;
import com.kpisentinel.analyzer.session.BaselineMemoryBank;
import com.kpisentinel.analyzer.session.BaselineNotFoundException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/baselines")
public class BaselineController {

    private final BaselineMemoryBank memoryBank;

    public BaselineController(BaselineMemoryBank memoryBank) {
        this.memoryBank = memoryBank;
    }

    @GetMapping("/{metric}")
    public ResponseEntity<BaselineResponseDto> baseline(@PathVariable("metric") String metric) {
        BaselineMemoryBank.Baseline baseline = memoryBank.retrieve(metric)
                .orElseThrow(() -> new BaselineNotFoundException(metric));
        return ResponseEntity.ok(new BaselineResponseDto(
                baseline.metric(), baseline.mean(), baseline.std(), baseline.storedAt()));
    }
}
