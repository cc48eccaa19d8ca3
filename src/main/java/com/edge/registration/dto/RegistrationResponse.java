package com.edge.registration.dto;

import com.edge.registration.core.registration.RegistrationAttempt;
import com.edge.registration.core.registration.RegistrationOutput;
import com.edge.registration.core.registration.RegistrationResult;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 配准响应
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RegistrationResponse {
    private String id;
    private String status;               // accepted / fallback / failed
    private String algorithm;
    private Double score;
    private Double inlierRatio;
    private Integer matchesCount;
    private double[][] homography;
    private Map<String, Object> metadata;
    private List<AttemptInfo> attempts = new ArrayList<>();
    private long processingTimeMs;
    private String warpedImage;          // Base64 JPEG，仅在请求时返回
    private String message;

    public static RegistrationResponse from(RegistrationOutput output, long processingTimeMs) {
        RegistrationResponse response = new RegistrationResponse();
        response.status = output.getStatus().getValue();
        response.algorithm = output.getAlgorithm();
        response.processingTimeMs = processingTimeMs;

        RegistrationResult result = output.getResult();
        if (result != null) {
            response.score = result.getScore();
            response.inlierRatio = result.getInlierRatio();
            response.matchesCount = result.getMatchesCount();
            response.homography = result.getHomography();
            response.metadata = result.getMetadata();
        }

        for (RegistrationAttempt attempt : output.getAttempts()) {
            response.attempts.add(AttemptInfo.from(attempt));
        }
        return response;
    }

    /**
     * 单项失败（如图片无法解码），不影响批量中的其他项
     */
    public static RegistrationResponse failed(String message) {
        RegistrationResponse response = new RegistrationResponse();
        response.status = "failed";
        response.message = message;
        return response;
    }

    // Getters and Setters
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public String getAlgorithm() { return algorithm; }
    public void setAlgorithm(String algorithm) { this.algorithm = algorithm; }

    public Double getScore() { return score; }
    public void setScore(Double score) { this.score = score; }

    public Double getInlierRatio() { return inlierRatio; }
    public void setInlierRatio(Double inlierRatio) { this.inlierRatio = inlierRatio; }

    public Integer getMatchesCount() { return matchesCount; }
    public void setMatchesCount(Integer matchesCount) { this.matchesCount = matchesCount; }

    public double[][] getHomography() { return homography; }
    public void setHomography(double[][] homography) { this.homography = homography; }

    public Map<String, Object> getMetadata() { return metadata; }
    public void setMetadata(Map<String, Object> metadata) { this.metadata = metadata; }

    public List<AttemptInfo> getAttempts() { return attempts; }
    public void setAttempts(List<AttemptInfo> attempts) { this.attempts = attempts; }

    public long getProcessingTimeMs() { return processingTimeMs; }
    public void setProcessingTimeMs(long processingTimeMs) { this.processingTimeMs = processingTimeMs; }

    public String getWarpedImage() { return warpedImage; }
    public void setWarpedImage(String warpedImage) { this.warpedImage = warpedImage; }

    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }

    /**
     * 单个算法的尝试摘要
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class AttemptInfo {
        private String algorithm;
        private String outcome;
        private Double score;
        private Double inlierRatio;
        private String error;

        public static AttemptInfo from(RegistrationAttempt attempt) {
            AttemptInfo info = new AttemptInfo();
            info.algorithm = attempt.getAlgorithm();
            info.outcome = attempt.getOutcome().name().toLowerCase();
            if (attempt.getResult() != null) {
                info.score = attempt.getResult().getScore();
                info.inlierRatio = attempt.getResult().getInlierRatio();
            }
            info.error = attempt.getError();
            return info;
        }

        public String getAlgorithm() { return algorithm; }
        public void setAlgorithm(String algorithm) { this.algorithm = algorithm; }

        public String getOutcome() { return outcome; }
        public void setOutcome(String outcome) { this.outcome = outcome; }

        public Double getScore() { return score; }
        public void setScore(Double score) { this.score = score; }

        public Double getInlierRatio() { return inlierRatio; }
        public void setInlierRatio(Double inlierRatio) { this.inlierRatio = inlierRatio; }

        public String getError() { return error; }
        public void setError(String error) { this.error = error; }
    }
}
