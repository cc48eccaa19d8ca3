package com.edge.registration.dto;

/**
 * 配准请求
 * <p>
 * minScore / minInlierRatio / enableFallback 为空时使用服务当前的验收策略
 */
public class RegistrationRequest {
    private String sourceImage;          // Base64编码的源图
    private String referenceImage;       // Base64编码的参考图
    private boolean includeWarpedImage;  // 是否返回变换到参考图坐标系的源图
    private Double minScore;
    private Double minInlierRatio;
    private Boolean enableFallback;

    public String getSourceImage() { return sourceImage; }
    public void setSourceImage(String sourceImage) { this.sourceImage = sourceImage; }

    public String getReferenceImage() { return referenceImage; }
    public void setReferenceImage(String referenceImage) { this.referenceImage = referenceImage; }

    public boolean isIncludeWarpedImage() { return includeWarpedImage; }
    public void setIncludeWarpedImage(boolean includeWarpedImage) { this.includeWarpedImage = includeWarpedImage; }

    public Double getMinScore() { return minScore; }
    public void setMinScore(Double minScore) { this.minScore = minScore; }

    public Double getMinInlierRatio() { return minInlierRatio; }
    public void setMinInlierRatio(Double minInlierRatio) { this.minInlierRatio = minInlierRatio; }

    public Boolean getEnableFallback() { return enableFallback; }
    public void setEnableFallback(Boolean enableFallback) { this.enableFallback = enableFallback; }
}
