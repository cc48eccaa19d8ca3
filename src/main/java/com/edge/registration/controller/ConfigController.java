package com.edge.registration.controller;

import com.edge.registration.config.YamlConfig;
import com.edge.registration.core.registration.EngineConfig;
import com.edge.registration.core.registration.ValidationException;
import com.edge.registration.core.registration.algorithm.RegistrationAlgorithmFactory;
import com.edge.registration.dto.EngineConfigRequest;
import com.edge.registration.service.RegistrationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;

/**
 * 配置管理控制器
 * <p>
 * 验收策略和算法列表的运行时调整，不会写回 application.yml
 */
@RestController
@RequestMapping("/api/config")
@Tag(name = "配准配置", description = "验收策略（质量门限、降级开关）和算法列表的运行时管理")
public class ConfigController {

    private static final Logger logger = LoggerFactory.getLogger(ConfigController.class);

    @Autowired
    private RegistrationService registrationService;

    /**
     * 获取当前验收策略
     */
    @GetMapping("/engine")
    @Operation(summary = "获取验收策略", description = "返回 minScore、minInlierRatio、enableFallback")
    public ResponseEntity<Map<String, Object>> getEngineConfig() {
        Map<String, Object> response = new HashMap<>();
        try {
            response.put("status", "success");
            response.put("data", toMap(registrationService.getEngineConfig()));
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            logger.error("Failed to get engine config", e);
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
        }
    }

    /**
     * 更新验收策略
     */
    @PostMapping("/engine")
    @Operation(summary = "更新验收策略", description = "只更新请求中给出的字段，阈值必须在 [0, 1] 内")
    public ResponseEntity<Map<String, Object>> updateEngineConfig(@RequestBody EngineConfigRequest request) {
        Map<String, Object> response = new HashMap<>();
        try {
            EngineConfig updated = registrationService.updateEngineConfig(request);
            response.put("status", "success");
            response.put("message", "验收策略已更新");
            response.put("data", toMap(updated));
            return ResponseEntity.ok(response);
        } catch (IllegalArgumentException | ValidationException e) {
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.badRequest().body(response);
        } catch (Exception e) {
            logger.error("Failed to update engine config", e);
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
        }
    }

    /**
     * 获取算法列表（按评估顺序）
     */
    @GetMapping("/algorithms")
    @Operation(summary = "获取算法列表", description = "按评估顺序返回已注册的算法名称")
    public ResponseEntity<Map<String, Object>> getAlgorithms() {
        Map<String, Object> response = new HashMap<>();
        try {
            Map<String, Object> data = new HashMap<>();
            data.put("algorithms", registrationService.getAlgorithmNames());
            data.put("supportedTypes", RegistrationAlgorithmFactory.SUPPORTED_TYPES);
            response.put("status", "success");
            response.put("data", data);
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            logger.error("Failed to get algorithms", e);
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
        }
    }

    /**
     * 注册或替换算法
     */
    @PostMapping("/algorithms")
    @Operation(summary = "注册算法", description = "新算法追加到末尾；同名算法被替换但保留原来的评估位置")
    public ResponseEntity<Map<String, Object>> addAlgorithm(@RequestBody YamlConfig.AlgorithmConfig request) {
        Map<String, Object> response = new HashMap<>();
        try {
            String name = registrationService.addAlgorithm(request);

            Map<String, Object> data = new HashMap<>();
            data.put("name", name);
            data.put("algorithms", registrationService.getAlgorithmNames());
            response.put("status", "success");
            response.put("data", data);
            return ResponseEntity.ok(response);
        } catch (IllegalArgumentException e) {
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.badRequest().body(response);
        } catch (Exception e) {
            logger.error("Failed to add algorithm", e);
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
        }
    }

    /**
     * 移除算法，不存在时不报错
     */
    @DeleteMapping("/algorithms/{name}")
    @Operation(summary = "移除算法", description = "算法不存在时同样返回成功，data.removed 为 false")
    public ResponseEntity<Map<String, Object>> removeAlgorithm(@PathVariable String name) {
        Map<String, Object> response = new HashMap<>();
        try {
            boolean removed = registrationService.removeAlgorithm(name);

            Map<String, Object> data = new HashMap<>();
            data.put("removed", removed);
            data.put("algorithms", registrationService.getAlgorithmNames());
            response.put("status", "success");
            response.put("data", data);
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            logger.error("Failed to remove algorithm {}", name, e);
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
        }
    }

    private Map<String, Object> toMap(EngineConfig config) {
        Map<String, Object> data = new HashMap<>();
        data.put("minScore", config.getMinScore());
        data.put("minInlierRatio", config.getMinInlierRatio());
        data.put("enableFallback", config.isEnableFallback());
        return data;
    }
}
