package com.edge.registration.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * 批量配准响应
 */
public class BatchRegistrationResponse {
    private List<RegistrationResponse> results = new ArrayList<>();
    private long processingTimeMs;

    public void add(RegistrationResponse response) {
        results.add(response);
    }

    public BatchSummary getSummary() {
        int accepted = 0, fallback = 0, failed = 0;
        for (RegistrationResponse r : results) {
            if ("accepted".equals(r.getStatus())) accepted++;
            else if ("fallback".equals(r.getStatus())) fallback++;
            else failed++;
        }
        return new BatchSummary(results.size(), accepted, fallback, failed);
    }

    public List<RegistrationResponse> getResults() { return results; }
    public void setResults(List<RegistrationResponse> results) { this.results = results; }

    public long getProcessingTimeMs() { return processingTimeMs; }
    public void setProcessingTimeMs(long processingTimeMs) { this.processingTimeMs = processingTimeMs; }

    /**
     * 批量统计
     */
    public static class BatchSummary {
        public final int total;
        public final int accepted;
        public final int fallback;
        public final int failed;

        public BatchSummary(int total, int accepted, int fallback, int failed) {
            this.total = total;
            this.accepted = accepted;
            this.fallback = fallback;
            this.failed = failed;
        }

        @Override
        public String toString() {
            return String.format("Summary[total=%d, accepted=%d, fallback=%d, failed=%d]",
                total, accepted, fallback, failed);
        }
    }
}
