package com.edge.registration.service;

import com.edge.registration.config.YamlConfig;
import com.edge.registration.core.registration.EngineConfig;
import com.edge.registration.core.registration.ImageRegistrationEngine;
import com.edge.registration.core.registration.RegistrationOutput;
import com.edge.registration.core.registration.algorithm.FeatureRegistrationAlgorithm;
import com.edge.registration.core.registration.algorithm.RegistrationAlgorithmFactory;
import com.edge.registration.dto.BatchRegistrationRequest;
import com.edge.registration.dto.BatchRegistrationResponse;
import com.edge.registration.dto.EngineConfigRequest;
import com.edge.registration.dto.RegistrationRequest;
import com.edge.registration.dto.RegistrationResponse;
import com.edge.registration.util.VisionTool;
import jakarta.annotation.PostConstruct;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 配准服务
 * <p>
 * 负责图片解码、调用配准引擎、可选的透视变换输出，以及运行时的策略和算法管理。
 * 引擎本身不是线程安全的，这里所有访问引擎的方法都加锁串行执行
 */
@Service
public class RegistrationService {
    private static final Logger logger = LoggerFactory.getLogger(RegistrationService.class);

    @Autowired
    private ImageRegistrationEngine<Mat> registrationEngine;

    @Autowired
    private YamlConfig yamlConfig;

    // 运行时验收策略，可通过接口修改
    private EngineConfig engineConfig;

    @PostConstruct
    public void init() {
        engineConfig = registrationEngine.getConfig();
        logger.info("RegistrationService initialized with algorithms {} and {}",
            registrationEngine.getAlgorithmNames(), engineConfig);
    }

    /**
     * 单张配准
     *
     * @throws IllegalArgumentException 图片缺失或无法解码
     * @throws com.edge.registration.core.registration.ValidationException 覆盖的阈值越界
     */
    public synchronized RegistrationResponse register(RegistrationRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Request body is required");
        }
        EngineConfig policy = resolvePolicy(request.getMinScore(), request.getMinInlierRatio(),
            request.getEnableFallback());

        Mat source = decode(request.getSourceImage(), "sourceImage");
        Mat reference = null;
        try {
            reference = decode(request.getReferenceImage(), "referenceImage");
            RegistrationResponse response = registerDecoded(source, reference, policy, request.isIncludeWarpedImage());
            logger.info("Registration finished: status={}, algorithm={}, {} ms",
                response.getStatus(), response.getAlgorithm(), response.getProcessingTimeMs());
            return response;
        } finally {
            source.release();
            if (reference != null) reference.release();
        }
    }

    /**
     * 批量配准：单项失败只记录在该项结果中，不中断整个批次
     *
     * @throws IllegalArgumentException 参考图缺失或无法解码
     */
    public synchronized BatchRegistrationResponse registerBatch(BatchRegistrationRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Request body is required");
        }
        EngineConfig policy = resolvePolicy(request.getMinScore(), request.getMinInlierRatio(),
            request.getEnableFallback());

        long startTime = System.currentTimeMillis();
        BatchRegistrationResponse batch = new BatchRegistrationResponse();
        Mat reference = decode(request.getReferenceImage(), "referenceImage");

        try {
            List<BatchRegistrationRequest.SourceItem> sources = request.getSources();
            if (sources == null || sources.isEmpty()) {
                logger.warn("Batch registration called without source images");
            } else {
                for (int i = 0; i < sources.size(); i++) {
                    BatchRegistrationRequest.SourceItem item = sources.get(i);
                    String id = item.getId() != null ? item.getId() : String.valueOf(i);
                    RegistrationResponse response = registerBatchItem(id, item.getImage(), reference, policy);
                    response.setId(id);
                    batch.add(response);
                }
            }
        } finally {
            reference.release();
        }

        batch.setProcessingTimeMs(System.currentTimeMillis() - startTime);
        logger.info("Batch registration finished: {} in {} ms", batch.getSummary(), batch.getProcessingTimeMs());
        return batch;
    }

    private RegistrationResponse registerBatchItem(String id, String image, Mat reference, EngineConfig policy) {
        Mat source = VisionTool.base64ToMat(image);
        if (source == null) {
            logger.warn("Batch item {}: source image missing or not decodable", id);
            return RegistrationResponse.failed("Invalid source image");
        }
        try {
            return registerDecoded(source, reference, policy, false);
        } catch (RuntimeException e) {
            logger.error("Batch item {} failed", id, e);
            return RegistrationResponse.failed(e.getMessage());
        } finally {
            source.release();
        }
    }

    private RegistrationResponse registerDecoded(Mat source, Mat reference, EngineConfig policy, boolean includeWarped) {
        long startTime = System.currentTimeMillis();
        RegistrationOutput output = registrationEngine.register(source, reference, policy);
        RegistrationResponse response = RegistrationResponse.from(output, System.currentTimeMillis() - startTime);

        if (includeWarped && output.hasResult() && output.getResult().getHomography() != null) {
            Mat warped = VisionTool.warpPerspective(source, output.getResult().getHomography(), reference.size());
            try {
                response.setWarpedImage(VisionTool.matToBase64(warped, yamlConfig.getWarp().getJpegQuality()));
            } finally {
                warped.release();
            }
        }
        return response;
    }

    private Mat decode(String base64, String field) {
        if (base64 == null || base64.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        Mat mat = VisionTool.base64ToMat(base64);
        if (mat == null) {
            throw new IllegalArgumentException(field + " is not a decodable image");
        }
        return mat;
    }

    /**
     * 在当前策略基础上应用单次覆盖
     */
    EngineConfig resolvePolicy(Double minScore, Double minInlierRatio, Boolean enableFallback) {
        EngineConfig policy = getEngineConfig();
        if (minScore != null) policy = policy.withMinScore(minScore);
        if (minInlierRatio != null) policy = policy.withMinInlierRatio(minInlierRatio);
        if (enableFallback != null) policy = policy.withEnableFallback(enableFallback);
        return policy;
    }

    public synchronized EngineConfig getEngineConfig() {
        return engineConfig;
    }

    /**
     * 更新验收策略，为空的字段保持不变
     */
    public synchronized EngineConfig updateEngineConfig(EngineConfigRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Request body is required");
        }
        EngineConfig updated = resolvePolicy(request.getMinScore(), request.getMinInlierRatio(),
            request.getEnableFallback());
        this.engineConfig = updated;
        logger.info("Engine config updated to: {}", updated);
        return updated;
    }

    public synchronized List<String> getAlgorithmNames() {
        return registrationEngine.getAlgorithmNames();
    }

    /**
     * 注册算法；同名算法会被替换但保留评估位置
     *
     * @return 注册名
     */
    public synchronized String addAlgorithm(YamlConfig.AlgorithmConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("Algorithm config is required");
        }
        String name = config.resolveName();
        FeatureRegistrationAlgorithm algorithm = RegistrationAlgorithmFactory.create(config);
        boolean replaced = registrationEngine.hasAlgorithm(name);
        registrationEngine.registerAlgorithm(name, algorithm);
        logger.info("Algorithm {} {} ({})", name, replaced ? "replaced" : "registered", config.getType());
        return name;
    }

    /**
     * 移除算法
     *
     * @return 算法是否存在
     */
    public synchronized boolean removeAlgorithm(String name) {
        boolean existed = registrationEngine.hasAlgorithm(name);
        registrationEngine.unregisterAlgorithm(name);
        if (existed) {
            logger.info("Algorithm {} removed", name);
        }
        return existed;
    }
}
