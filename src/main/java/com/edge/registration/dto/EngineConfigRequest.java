package com.edge.registration.dto;

/**
 * 验收策略更新请求，为空的字段保持不变
 */
public class EngineConfigRequest {
    private Double minScore;
    private Double minInlierRatio;
    private Boolean enableFallback;

    public Double getMinScore() { return minScore; }
    public void setMinScore(Double minScore) { this.minScore = minScore; }

    public Double getMinInlierRatio() { return minInlierRatio; }
    public void setMinInlierRatio(Double minInlierRatio) { this.minInlierRatio = minInlierRatio; }

    public Boolean getEnableFallback() { return enableFallback; }
    public void setEnableFallback(Boolean enableFallback) { this.enableFallback = enableFallback; }
}
