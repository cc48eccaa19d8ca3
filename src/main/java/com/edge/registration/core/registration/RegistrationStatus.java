package com.edge.registration.core.registration;

/**
 * 配准决策状态
 */
public enum RegistrationStatus {
    /**
     * 接受：某个算法的结果通过了质量门限
     */
    ACCEPTED("accepted"),

    /**
     * 降级：没有结果过关，返回得分最高的候选（置信度不足，调用方需自行判断）
     */
    FALLBACK("fallback"),

    /**
     * 失败：没有可用结果，或降级被禁用
     */
    FAILED("failed");

    private final String value;

    RegistrationStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
