package com.edge.registration.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * 批量配准请求：多张源图对同一张参考图
 */
public class BatchRegistrationRequest {
    private String referenceImage;
    private List<SourceItem> sources = new ArrayList<>();
    private Double minScore;
    private Double minInlierRatio;
    private Boolean enableFallback;

    public String getReferenceImage() { return referenceImage; }
    public void setReferenceImage(String referenceImage) { this.referenceImage = referenceImage; }

    public List<SourceItem> getSources() { return sources; }
    public void setSources(List<SourceItem> sources) { this.sources = sources; }

    public Double getMinScore() { return minScore; }
    public void setMinScore(Double minScore) { this.minScore = minScore; }

    public Double getMinInlierRatio() { return minInlierRatio; }
    public void setMinInlierRatio(Double minInlierRatio) { this.minInlierRatio = minInlierRatio; }

    public Boolean getEnableFallback() { return enableFallback; }
    public void setEnableFallback(Boolean enableFallback) { this.enableFallback = enableFallback; }

    public static class SourceItem {
        private String id;       // 调用方标识，如答题卡编号
        private String image;    // Base64编码的源图

        public SourceItem() {}

        public SourceItem(String id, String image) {
            this.id = id;
            this.image = image;
        }

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getImage() { return image; }
        public void setImage(String image) { this.image = image; }
    }
}
