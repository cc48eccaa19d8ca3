package com.edge.registration.core.registration;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 一次 register 调用的最终决策
 * <p>
 * ACCEPTED / FALLBACK 时带有算法名和结果；FAILED 时两者均为 null。
 * 调用方必须检查 status，FALLBACK 不等同于 ACCEPTED
 */
public final class RegistrationOutput {
    private final String algorithm;
    private final RegistrationStatus status;
    private final RegistrationResult result;
    private final List<RegistrationAttempt> attempts;

    private RegistrationOutput(String algorithm,
                               RegistrationStatus status,
                               RegistrationResult result,
                               List<RegistrationAttempt> attempts) {
        this.algorithm = algorithm;
        this.status = status;
        this.result = result;
        this.attempts = attempts == null
            ? Collections.emptyList()
            : Collections.unmodifiableList(List.copyOf(attempts));
    }

    public static RegistrationOutput accepted(String algorithm, RegistrationResult result,
                                              List<RegistrationAttempt> attempts) {
        return new RegistrationOutput(requireAlgorithm(algorithm), RegistrationStatus.ACCEPTED,
            requireResult(result), attempts);
    }

    public static RegistrationOutput fallback(String algorithm, RegistrationResult result,
                                              List<RegistrationAttempt> attempts) {
        return new RegistrationOutput(requireAlgorithm(algorithm), RegistrationStatus.FALLBACK,
            requireResult(result), attempts);
    }

    public static RegistrationOutput failed(List<RegistrationAttempt> attempts) {
        return new RegistrationOutput(null, RegistrationStatus.FAILED, null, attempts);
    }

    private static String requireAlgorithm(String algorithm) {
        if (algorithm == null) {
            throw new IllegalArgumentException("Algorithm name is required for a selected result");
        }
        return algorithm;
    }

    private static RegistrationResult requireResult(RegistrationResult result) {
        if (result == null) {
            throw new IllegalArgumentException("Result is required for a selected result");
        }
        return result;
    }

    public String getAlgorithm() { return algorithm; }

    public RegistrationStatus getStatus() { return status; }

    public RegistrationResult getResult() { return result; }

    /**
     * 按调用顺序排列的尝试记录
     */
    public List<RegistrationAttempt> getAttempts() { return attempts; }

    public boolean isAccepted() {
        return status == RegistrationStatus.ACCEPTED;
    }

    public boolean hasResult() {
        return result != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RegistrationOutput)) return false;
        RegistrationOutput that = (RegistrationOutput) o;
        return Objects.equals(algorithm, that.algorithm)
            && status == that.status
            && Objects.equals(result, that.result)
            && attempts.equals(that.attempts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(algorithm, status, result, attempts);
    }

    @Override
    public String toString() {
        return String.format("RegistrationOutput[%s: algorithm=%s, result=%s, attempts=%d]",
            status.getValue(), algorithm, result, attempts.size());
    }
}
