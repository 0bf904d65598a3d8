package com.work.healthcheck.demo.web;

import com.work.healthcheck.core.engine.HealthLoop;
import com.work.healthcheck.demo.config.HealthcheckProperties;
import com.work.healthcheck.demo.web.dto.HealthcheckStatusResponse;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 暴露简单的运维接口：查看最近一轮结果，手动停止健康检查。
 */
@RestController
@RequestMapping("/api/healthcheck")
public class HealthcheckController {

    private final ObjectProvider<HealthLoop> healthLoop;
    private final HealthcheckProperties properties;

    public HealthcheckController(ObjectProvider<HealthLoop> healthLoop, HealthcheckProperties properties) {
        this.healthLoop = healthLoop;
        this.properties = properties;
    }

    @GetMapping
    public ResponseEntity<HealthcheckStatusResponse> status() {
        HealthLoop loop = healthLoop.getIfAvailable();
        if (loop == null) {
            return ResponseEntity.ok(HealthcheckStatusResponse.disabled(properties));
        }
        return ResponseEntity.ok(HealthcheckStatusResponse.fromLoop(loop, properties));
    }

    /**
     * 阻塞直到后台循环退出。
     */
    @PostMapping("/shutdown")
    public ResponseEntity<HealthcheckStatusResponse> shutdown() {
        HealthLoop loop = healthLoop.getIfAvailable();
        if (loop == null) {
            return ResponseEntity.notFound().build();
        }
        loop.shutdown();
        return ResponseEntity.ok(HealthcheckStatusResponse.fromLoop(loop, properties));
    }
}
