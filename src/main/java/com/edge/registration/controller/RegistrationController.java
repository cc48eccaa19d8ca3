package com.edge.registration.controller;

import com.edge.registration.core.registration.ValidationException;
import com.edge.registration.dto.BatchRegistrationRequest;
import com.edge.registration.dto.BatchRegistrationResponse;
import com.edge.registration.dto.RegistrationRequest;
import com.edge.registration.dto.RegistrationResponse;
import com.edge.registration.service.RegistrationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * 图像配准控制器
 * <p>
 * 配准结果的 status 为 failed 时 HTTP 状态仍为 200，质量不足不是请求错误
 */
@RestController
@RequestMapping("/api/registration")
@Tag(name = "图像配准", description = "多算法图像配准（单张 / 批量），返回接受、降级或失败的决策")
public class RegistrationController {
    private static final Logger logger = LoggerFactory.getLogger(RegistrationController.class);

    @Autowired
    private RegistrationService registrationService;

    /**
     * 单张配准
     */
    @PostMapping("/register")
    @Operation(
            summary = "配准单张图像",
            description = """
                    将源图配准到参考图。按配置顺序依次尝试各算法，第一个通过质量门限的结果被接受。

                    **请求参数**：
                    | 字段 | 类型 | 说明 |
                    |------|------|------|
                    | sourceImage | string | Base64 源图（支持 data URL 前缀） |
                    | referenceImage | string | Base64 参考图 |
                    | includeWarpedImage | boolean | 是否返回变换后的源图 |
                    | minScore / minInlierRatio / enableFallback | 可选 | 仅本次请求生效的验收策略 |

                    **注意**：data.status 为 fallback 时结果置信度不足，调用方需自行判断是否使用。
                    """
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "配准完成",
                    content = @Content(
                            mediaType = "application/json",
                            examples = @ExampleObject(
                                    value = """
                                            {
                                              "status": "success",
                                              "data": {
                                                "status": "accepted",
                                                "algorithm": "SIFT",
                                                "score": 0.93,
                                                "inlierRatio": 0.81,
                                                "matchesCount": 214,
                                                "homography": [[1.01, 0.0, 3.2], [0.0, 0.99, -1.5], [0.0, 0.0, 1.0]],
                                                "attempts": [{"algorithm": "SIFT", "outcome": "accepted", "score": 0.93, "inlierRatio": 0.81}],
                                                "processingTimeMs": 182
                                              }
                                            }
                                            """
                            )
                    )
            )
    })
    public ResponseEntity<Map<String, Object>> register(@RequestBody RegistrationRequest request) {
        Map<String, Object> response = new HashMap<>();
        try {
            RegistrationResponse result = registrationService.register(request);
            response.put("status", "success");
            response.put("data", result);
            return ResponseEntity.ok(response);
        } catch (IllegalArgumentException | ValidationException e) {
            logger.warn("Invalid registration request: {}", e.getMessage());
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.badRequest().body(response);
        } catch (Exception e) {
            logger.error("Registration failed", e);
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
        }
    }

    /**
     * 批量配准
     */
    @PostMapping("/batch")
    @Operation(
            summary = "批量配准",
            description = """
                    多张源图对同一张参考图进行配准。单项失败（如图片无法解码、质量不足）
                    只体现在该项结果中，不会中断整个批次。
                    """
    )
    public ResponseEntity<Map<String, Object>> registerBatch(@RequestBody BatchRegistrationRequest request) {
        Map<String, Object> response = new HashMap<>();
        try {
            BatchRegistrationResponse result = registrationService.registerBatch(request);
            response.put("status", "success");
            response.put("data", result);
            return ResponseEntity.ok(response);
        } catch (IllegalArgumentException | ValidationException e) {
            logger.warn("Invalid batch registration request: {}", e.getMessage());
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.badRequest().body(response);
        } catch (Exception e) {
            logger.error("Batch registration failed", e);
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
        }
    }
}
