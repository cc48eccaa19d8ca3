package com.edge.registration.core.registration;

import java.util.Objects;

/**
 * 单个算法的一次尝试记录
 * <p>
 * 用于区分"没有找到对齐"和"找到了对齐但未通过质量门限"
 */
public final class RegistrationAttempt {
    private final String algorithm;
    private final AttemptOutcome outcome;
    private final RegistrationResult result;
    private final String error;

    public enum AttemptOutcome {
        /** 算法没有给出结果 */
        NO_RESULT,
        /** 有结果但未通过质量门限 */
        REJECTED,
        /** 结果通过质量门限 */
        ACCEPTED,
        /** 算法抛出异常 */
        FAULTED
    }

    private RegistrationAttempt(String algorithm, AttemptOutcome outcome, RegistrationResult result, String error) {
        this.algorithm = algorithm;
        this.outcome = outcome;
        this.result = result;
        this.error = error;
    }

    public static RegistrationAttempt noResult(String algorithm) {
        return new RegistrationAttempt(algorithm, AttemptOutcome.NO_RESULT, null, null);
    }

    public static RegistrationAttempt rejected(String algorithm, RegistrationResult result) {
        return new RegistrationAttempt(algorithm, AttemptOutcome.REJECTED, result, null);
    }

    public static RegistrationAttempt accepted(String algorithm, RegistrationResult result) {
        return new RegistrationAttempt(algorithm, AttemptOutcome.ACCEPTED, result, null);
    }

    public static RegistrationAttempt faulted(String algorithm, Throwable fault) {
        String error = fault.getMessage() != null
            ? fault.getClass().getSimpleName() + ": " + fault.getMessage()
            : fault.getClass().getSimpleName();
        return new RegistrationAttempt(algorithm, AttemptOutcome.FAULTED, null, error);
    }

    public String getAlgorithm() { return algorithm; }

    public AttemptOutcome getOutcome() { return outcome; }

    /**
     * REJECTED / ACCEPTED 时不为 null
     */
    public RegistrationResult getResult() { return result; }

    /**
     * FAULTED 时为异常描述
     */
    public String getError() { return error; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RegistrationAttempt)) return false;
        RegistrationAttempt that = (RegistrationAttempt) o;
        return algorithm.equals(that.algorithm)
            && outcome == that.outcome
            && Objects.equals(result, that.result)
            && Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(algorithm, outcome, result, error);
    }

    @Override
    public String toString() {
        return "RegistrationAttempt[" + algorithm + ": " + outcome
            + (error != null ? " (" + error + ")" : "") + "]";
    }
}
