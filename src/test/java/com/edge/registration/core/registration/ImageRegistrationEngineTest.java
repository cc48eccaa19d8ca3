package com.edge.registration.core.registration;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImageRegistrationEngineTest {

    private static final double[][] IDENTITY = {{1, 0, 0}, {0, 1, 0}, {0, 0, 1}};

    private ch.qos.logback.classic.Logger sink;
    private ListAppender<ILoggingEvent> events;
    private List<String> invocations;

    @BeforeEach
    void setUp() {
        sink = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger("registration.test." + UUID.randomUUID());
        sink.setLevel(Level.DEBUG);
        sink.setAdditive(false);
        events = new ListAppender<>();
        events.start();
        sink.addAppender(events);
        invocations = new ArrayList<>();
    }

    // ---------------------------------------------------------------
    // 测试用算法
    // ---------------------------------------------------------------

    private class FixedAlgorithm implements RegistrationAlgorithm<String> {
        private final String label;
        private final RegistrationResult result;

        FixedAlgorithm(String label, RegistrationResult result) {
            this.label = label;
            this.result = result;
        }

        @Override
        public Optional<RegistrationResult> align(String source, String reference) {
            invocations.add(label);
            return Optional.ofNullable(result);
        }
    }

    private class FailingAlgorithm implements RegistrationAlgorithm<String> {
        private final String label;

        FailingAlgorithm(String label) {
            this.label = label;
        }

        @Override
        public Optional<RegistrationResult> align(String source, String reference) {
            invocations.add(label);
            throw new IllegalStateException("Simulated algorithm failure");
        }
    }

    private static RegistrationResult result(double score, double inlierRatio) {
        return new RegistrationResult(score, inlierRatio, IDENTITY, 100);
    }

    private ImageRegistrationEngine<String> engine(Map<String, RegistrationAlgorithm<String>> algorithms) {
        return new ImageRegistrationEngine<>(algorithms, null, sink);
    }

    private ImageRegistrationEngine<String> engine(Map<String, RegistrationAlgorithm<String>> algorithms,
                                                   EngineConfig config) {
        return new ImageRegistrationEngine<>(algorithms, config, sink);
    }

    private Map<String, RegistrationAlgorithm<String>> ordered() {
        return new LinkedHashMap<>();
    }

    private List<ILoggingEvent> eventsAt(Level level, String kind) {
        return events.list.stream()
            .filter(e -> e.getLevel() == level)
            .filter(e -> e.getFormattedMessage().startsWith("event=" + kind + " "))
            .collect(Collectors.toList());
    }

    // ---------------------------------------------------------------
    // 决策流程
    // ---------------------------------------------------------------

    @Test
    void emptyEngineAlwaysFails() {
        ImageRegistrationEngine<String> engine = engine(ordered());

        RegistrationOutput output = engine.register("src", "ref");

        assertThat(output.getStatus()).isEqualTo(RegistrationStatus.FAILED);
        assertThat(output.getAlgorithm()).isNull();
        assertThat(output.getResult()).isNull();
        assertThat(output.getAttempts()).isEmpty();
        assertThat(eventsAt(Level.WARN, "decision")).hasSize(1);
    }

    @Test
    void singleAlgorithmAboveThresholdsIsAccepted() {
        Map<String, RegistrationAlgorithm<String>> algorithms = ordered();
        algorithms.put("SIFT", new FixedAlgorithm("SIFT", result(0.95, 0.80)));

        RegistrationOutput output = engine(algorithms).register("src", "ref");

        assertThat(output.getStatus()).isEqualTo(RegistrationStatus.ACCEPTED);
        assertThat(output.getAlgorithm()).isEqualTo("SIFT");
        assertThat(output.getResult().getScore()).isEqualTo(0.95);
        assertThat(output.isAccepted()).isTrue();
    }

    @Test
    void firstAcceptableResultShortCircuits() {
        Map<String, RegistrationAlgorithm<String>> algorithms = ordered();
        algorithms.put("SIFT", new FixedAlgorithm("SIFT", result(0.92, 0.75)));
        algorithms.put("ORB", new FixedAlgorithm("ORB", result(0.99, 0.99)));

        RegistrationOutput output = engine(algorithms).register("src", "ref");

        assertThat(output.getAlgorithm()).isEqualTo("SIFT");
        assertThat(invocations).containsExactly("SIFT");
        assertThat(output.getAttempts()).extracting(RegistrationAttempt::getAlgorithm).containsExactly("SIFT");
    }

    @Test
    void resultFailingGateIsSkippedForLaterAcceptableOne() {
        Map<String, RegistrationAlgorithm<String>> algorithms = ordered();
        algorithms.put("A", new FixedAlgorithm("A", result(0.70, 0.45)));
        algorithms.put("B", new FixedAlgorithm("B", result(0.92, 0.75)));

        RegistrationOutput output = engine(algorithms).register("src", "ref");

        assertThat(output.getStatus()).isEqualTo(RegistrationStatus.ACCEPTED);
        assertThat(output.getAlgorithm()).isEqualTo("B");
        assertThat(output.getAttempts()).extracting(RegistrationAttempt::getOutcome).containsExactly(
            RegistrationAttempt.AttemptOutcome.REJECTED, RegistrationAttempt.AttemptOutcome.ACCEPTED);
    }

    @Test
    void fallbackReturnsStrictlyHighestScore() {
        Map<String, RegistrationAlgorithm<String>> algorithms = ordered();
        algorithms.put("A", new FixedAlgorithm("A", result(0.50, 0.20)));
        algorithms.put("B", new FixedAlgorithm("B", result(0.72, 0.45)));

        RegistrationOutput output = engine(algorithms).register("src", "ref");

        assertThat(output.getStatus()).isEqualTo(RegistrationStatus.FALLBACK);
        assertThat(output.getAlgorithm()).isEqualTo("B");
        assertThat(output.getResult().getScore()).isEqualTo(0.72);
        assertThat(eventsAt(Level.INFO, "decision")).hasSize(1);
    }

    @Test
    void fallbackDisabledReportsFailure() {
        Map<String, RegistrationAlgorithm<String>> algorithms = ordered();
        algorithms.put("A", new FixedAlgorithm("A", result(0.50, 0.20)));
        algorithms.put("B", new FixedAlgorithm("B", result(0.72, 0.45)));

        RegistrationOutput output = engine(algorithms, new EngineConfig(0.85, 0.6, false)).register("src", "ref");

        assertThat(output.getStatus()).isEqualTo(RegistrationStatus.FAILED);
        assertThat(output.getAlgorithm()).isNull();
        assertThat(output.getResult()).isNull();
        assertThat(output.getAttempts()).hasSize(2);
        assertThat(eventsAt(Level.WARN, "decision")).hasSize(1);
    }

    @Test
    void fallbackTieGoesToEarliestRegistered() {
        Map<String, RegistrationAlgorithm<String>> algorithms = ordered();
        algorithms.put("A", new FixedAlgorithm("A", result(0.70, 0.30)));
        algorithms.put("B", new FixedAlgorithm("B", result(0.70, 0.50)));

        RegistrationOutput output = engine(algorithms).register("src", "ref");

        assertThat(output.getStatus()).isEqualTo(RegistrationStatus.FALLBACK);
        assertThat(output.getAlgorithm()).isEqualTo("A");
        assertThat(output.getResult().getInlierRatio()).isEqualTo(0.30);
    }

    @Test
    void allAbsentFailsEvenWithFallbackEnabled() {
        Map<String, RegistrationAlgorithm<String>> algorithms = ordered();
        algorithms.put("SIFT", new FixedAlgorithm("SIFT", null));
        algorithms.put("ORB", new FixedAlgorithm("ORB", null));

        RegistrationOutput output = engine(algorithms).register("src", "ref");

        assertThat(output.getStatus()).isEqualTo(RegistrationStatus.FAILED);
        assertThat(output.getAttempts()).extracting(RegistrationAttempt::getOutcome).containsOnly(
            RegistrationAttempt.AttemptOutcome.NO_RESULT);
        assertThat(invocations).containsExactly("SIFT", "ORB");
    }

    @Test
    void allFaultedFails() {
        Map<String, RegistrationAlgorithm<String>> algorithms = ordered();
        algorithms.put("Fail1", new FailingAlgorithm("Fail1"));
        algorithms.put("Fail2", new FailingAlgorithm("Fail2"));

        RegistrationOutput output = engine(algorithms).register("src", "ref");

        assertThat(output.getStatus()).isEqualTo(RegistrationStatus.FAILED);
        assertThat(eventsAt(Level.WARN, "attempt_fault")).hasSize(2);
    }

    @Test
    void faultIsRecoveredAndReportedToSink() {
        Map<String, RegistrationAlgorithm<String>> algorithms = ordered();
        algorithms.put("Broken", new FailingAlgorithm("Broken"));
        algorithms.put("SIFT", new FixedAlgorithm("SIFT", result(0.92, 0.75)));

        RegistrationOutput output = engine(algorithms).register("src", "ref");

        assertThat(output.getStatus()).isEqualTo(RegistrationStatus.ACCEPTED);
        assertThat(output.getAlgorithm()).isEqualTo("SIFT");

        List<ILoggingEvent> faults = eventsAt(Level.WARN, "attempt_fault");
        assertThat(faults).hasSize(1);
        assertThat(faults.get(0).getFormattedMessage()).contains("algorithm=Broken");
        assertThat(faults.get(0).getThrowableProxy()).isNotNull();

        RegistrationAttempt first = output.getAttempts().get(0);
        assertThat(first.getOutcome()).isEqualTo(RegistrationAttempt.AttemptOutcome.FAULTED);
        assertThat(first.getError()).contains("Simulated algorithm failure");
    }

    @Test
    void algorithmExceptionIsRecordedAsFault() {
        Map<String, RegistrationAlgorithm<String>> algorithms = ordered();
        algorithms.put("AKAZE", (source, reference) -> {
            throw new AlgorithmException("AKAZE: OpenCV native library is not loaded");
        });

        RegistrationOutput output = engine(algorithms).register("src", "ref");

        assertThat(output.getStatus()).isEqualTo(RegistrationStatus.FAILED);
        assertThat(output.getAttempts().get(0).getError())
            .isEqualTo("AlgorithmException: AKAZE: OpenCV native library is not loaded");
    }

    @Test
    void linkageErrorDoesNotAbortRegistration() {
        Map<String, RegistrationAlgorithm<String>> algorithms = ordered();
        algorithms.put("SURF", (source, reference) -> {
            throw new NoClassDefFoundError("org/opencv/xfeatures2d/SURF");
        });
        algorithms.put("SIFT", new FixedAlgorithm("SIFT", result(0.95, 0.80)));

        RegistrationOutput output = engine(algorithms).register("src", "ref");

        assertThat(output.getStatus()).isEqualTo(RegistrationStatus.ACCEPTED);
        assertThat(output.getAlgorithm()).isEqualTo("SIFT");
        assertThat(output.getAttempts().get(0).getOutcome()).isEqualTo(RegistrationAttempt.AttemptOutcome.FAULTED);
        assertThat(output.getAttempts().get(0).getError()).startsWith("NoClassDefFoundError");
        assertThat(eventsAt(Level.WARN, "attempt_fault")).hasSize(1);
    }

    @Test
    void assertionErrorIsRecordedAsFault() {
        Map<String, RegistrationAlgorithm<String>> algorithms = ordered();
        algorithms.put("Broken", (source, reference) -> {
            throw new AssertionError("unexpected state");
        });

        RegistrationOutput output = engine(algorithms).register("src", "ref");

        assertThat(output.getStatus()).isEqualTo(RegistrationStatus.FAILED);
        assertThat(output.getAttempts().get(0).getError()).isEqualTo("AssertionError: unexpected state");
    }

    @Test
    void virtualMachineErrorIsNotSwallowed() {
        Map<String, RegistrationAlgorithm<String>> algorithms = ordered();
        algorithms.put("Greedy", (source, reference) -> {
            throw new OutOfMemoryError("Java heap space");
        });

        assertThatThrownBy(() -> engine(algorithms).register("src", "ref"))
            .isInstanceOf(OutOfMemoryError.class);
    }

    @Test
    void nullOptionalIsTreatedAsNoResult() {
        Map<String, RegistrationAlgorithm<String>> algorithms = ordered();
        algorithms.put("Sloppy", (source, reference) -> null);
        algorithms.put("SIFT", new FixedAlgorithm("SIFT", result(0.40, 0.20)));

        RegistrationOutput output = engine(algorithms).register("src", "ref");

        assertThat(output.getStatus()).isEqualTo(RegistrationStatus.FALLBACK);
        assertThat(output.getAttempts().get(0).getOutcome()).isEqualTo(RegistrationAttempt.AttemptOutcome.NO_RESULT);
    }

    @Test
    void noResultAndRejectedResultStayDistinguishable() {
        Map<String, RegistrationAlgorithm<String>> algorithms = ordered();
        algorithms.put("None", new FixedAlgorithm("None", null));
        algorithms.put("Weak", new FixedAlgorithm("Weak", result(0.30, 0.10)));

        RegistrationOutput output = engine(algorithms, new EngineConfig(0.85, 0.6, false)).register("src", "ref");

        assertThat(output.getStatus()).isEqualTo(RegistrationStatus.FAILED);
        assertThat(output.getAttempts().get(0).getOutcome()).isEqualTo(RegistrationAttempt.AttemptOutcome.NO_RESULT);
        assertThat(output.getAttempts().get(0).getResult()).isNull();
        assertThat(output.getAttempts().get(1).getOutcome()).isEqualTo(RegistrationAttempt.AttemptOutcome.REJECTED);
        assertThat(output.getAttempts().get(1).getResult().getScore()).isEqualTo(0.30);
    }

    // ---------------------------------------------------------------
    // 门限边界
    // ---------------------------------------------------------------

    @Test
    void resultExactlyAtThresholdsIsAccepted() {
        Map<String, RegistrationAlgorithm<String>> algorithms = ordered();
        algorithms.put("SIFT", new FixedAlgorithm("SIFT", result(0.85, 0.6)));

        assertThat(engine(algorithms).register("src", "ref").getStatus()).isEqualTo(RegistrationStatus.ACCEPTED);
    }

    @Test
    void highScoreWithLowInlierRatioIsNotAccepted() {
        Map<String, RegistrationAlgorithm<String>> algorithms = ordered();
        algorithms.put("SIFT", new FixedAlgorithm("SIFT", result(0.95, 0.30)));

        assertThat(engine(algorithms).register("src", "ref").getStatus()).isEqualTo(RegistrationStatus.FALLBACK);
    }

    @Test
    void zeroMatchResultCanStillBeFallback() {
        Map<String, RegistrationAlgorithm<String>> algorithms = ordered();
        algorithms.put("SIFT", new FixedAlgorithm("SIFT", new RegistrationResult(0.0, 0.0, null, 0)));

        RegistrationOutput output = engine(algorithms).register("src", "ref");

        assertThat(output.getStatus()).isEqualTo(RegistrationStatus.FALLBACK);
        assertThat(output.getResult().getMatchesCount()).isZero();
    }

    @Test
    void customThresholdsAreRespected() {
        Map<String, RegistrationAlgorithm<String>> algorithms = ordered();
        algorithms.put("SIFT", new FixedAlgorithm("SIFT", result(0.75, 0.65)));

        RegistrationOutput output = engine(algorithms, new EngineConfig(0.70, 0.60, true)).register("src", "ref");

        assertThat(output.getStatus()).isEqualTo(RegistrationStatus.ACCEPTED);
    }

    @Test
    void perCallPolicyOverridesEngineConfig() {
        Map<String, RegistrationAlgorithm<String>> algorithms = ordered();
        algorithms.put("SIFT", new FixedAlgorithm("SIFT", result(0.75, 0.65)));
        ImageRegistrationEngine<String> engine = engine(algorithms);

        assertThat(engine.register("src", "ref").getStatus()).isEqualTo(RegistrationStatus.FALLBACK);
        assertThat(engine.register("src", "ref", new EngineConfig(0.70, 0.60, true)).getStatus())
            .isEqualTo(RegistrationStatus.ACCEPTED);
        assertThat(engine.register("src", "ref", EngineConfig.defaults().withEnableFallback(false)).getStatus())
            .isEqualTo(RegistrationStatus.FAILED);
        assertThat(engine.getConfig()).isEqualTo(EngineConfig.defaults());
    }

    @Test
    void metadataIsPassedThrough() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("keypoints", 250);
        metadata.put("descriptor_type", "SIFT");
        Map<String, RegistrationAlgorithm<String>> algorithms = ordered();
        algorithms.put("SIFT", new FixedAlgorithm("SIFT", new RegistrationResult(0.90, 0.70, IDENTITY, 120, metadata)));

        RegistrationOutput output = engine(algorithms).register("src", "ref");

        assertThat(output.getResult().getMetadata()).containsEntry("keypoints", 250).containsEntry("descriptor_type", "SIFT");
        assertThat(output.getResult().getHomography()).isDeepEqualTo(IDENTITY);
    }

    @Test
    void repeatedCallsYieldEqualOutputs() {
        Map<String, RegistrationAlgorithm<String>> algorithms = ordered();
        algorithms.put("Broken", new FailingAlgorithm("Broken"));
        algorithms.put("A", new FixedAlgorithm("A", result(0.50, 0.20)));
        algorithms.put("B", new FixedAlgorithm("B", result(0.72, 0.45)));
        ImageRegistrationEngine<String> engine = engine(algorithms);

        RegistrationOutput first = engine.register("src", "ref");
        RegistrationOutput second = engine.register("src", "ref");

        assertThat(second).isEqualTo(first);
        assertThat(second.hashCode()).isEqualTo(first.hashCode());
    }

    // ---------------------------------------------------------------
    // 算法注册表
    // ---------------------------------------------------------------

    @Test
    void replacingAlgorithmKeepsItsPosition() {
        Map<String, RegistrationAlgorithm<String>> algorithms = ordered();
        algorithms.put("A", new FixedAlgorithm("A", null));
        algorithms.put("B", new FixedAlgorithm("B", null));
        algorithms.put("C", new FixedAlgorithm("C", null));
        ImageRegistrationEngine<String> engine = engine(algorithms);

        engine.registerAlgorithm("B", new FixedAlgorithm("B-new", null));
        engine.register("src", "ref");

        assertThat(engine.getAlgorithmNames()).containsExactly("A", "B", "C");
        assertThat(invocations).containsExactly("A", "B-new", "C");
    }

    @Test
    void newAlgorithmIsAppended() {
        Map<String, RegistrationAlgorithm<String>> algorithms = ordered();
        algorithms.put("SIFT", new FixedAlgorithm("SIFT", null));
        ImageRegistrationEngine<String> engine = engine(algorithms);

        engine.registerAlgorithm("ORB", new FixedAlgorithm("ORB", result(0.92, 0.75)));
        RegistrationOutput output = engine.register("src", "ref");

        assertThat(engine.getAlgorithmNames()).containsExactly("SIFT", "ORB");
        assertThat(output.getAlgorithm()).isEqualTo("ORB");
    }

    @Test
    void unregisterRemovesAndIgnoresUnknownNames() {
        Map<String, RegistrationAlgorithm<String>> algorithms = ordered();
        algorithms.put("SIFT", new FixedAlgorithm("SIFT", result(0.92, 0.75)));
        algorithms.put("ORB", new FixedAlgorithm("ORB", result(0.92, 0.75)));
        ImageRegistrationEngine<String> engine = engine(algorithms);

        engine.unregisterAlgorithm("ORB");
        engine.unregisterAlgorithm("AKAZE");

        assertThat(engine.getAlgorithmNames()).containsExactly("SIFT");
        assertThat(engine.hasAlgorithm("ORB")).isFalse();
    }

    @Test
    void removingLastAlgorithmIsAllowed() {
        Map<String, RegistrationAlgorithm<String>> algorithms = ordered();
        algorithms.put("SIFT", new FixedAlgorithm("SIFT", result(0.92, 0.75)));
        ImageRegistrationEngine<String> engine = engine(algorithms);

        engine.unregisterAlgorithm("SIFT");

        assertThat(engine.size()).isZero();
        assertThat(engine.register("src", "ref").getStatus()).isEqualTo(RegistrationStatus.FAILED);
    }

    @Test
    void constructorCopiesTheAlgorithmMap() {
        Map<String, RegistrationAlgorithm<String>> algorithms = ordered();
        algorithms.put("SIFT", new FixedAlgorithm("SIFT", null));
        ImageRegistrationEngine<String> engine = engine(algorithms);

        algorithms.put("ORB", new FixedAlgorithm("ORB", null));

        assertThat(engine.getAlgorithmNames()).containsExactly("SIFT");
        assertThatThrownBy(() -> engine.getAlgorithmNames().add("ORB"))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void nullNameOrAlgorithmIsRejected() {
        ImageRegistrationEngine<String> engine = engine(ordered());

        assertThatThrownBy(() -> engine.registerAlgorithm(null, new FixedAlgorithm("X", null)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> engine.registerAlgorithm("X", null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void defaultsApplyWhenConfigAndLoggerAreOmitted() {
        ImageRegistrationEngine<String> engine = new ImageRegistrationEngine<>(null);

        assertThat(engine.getConfig()).isEqualTo(EngineConfig.defaults());
        assertThat(engine.register("src", "ref").getStatus()).isEqualTo(RegistrationStatus.FAILED);
    }

    // ---------------------------------------------------------------
    // 诊断日志
    // ---------------------------------------------------------------

    @Test
    void everyAttemptIsReported() {
        Map<String, RegistrationAlgorithm<String>> algorithms = ordered();
        algorithms.put("A", new FixedAlgorithm("A", null));
        algorithms.put("B", new FixedAlgorithm("B", result(0.92, 0.75)));

        engine(algorithms).register("src", "ref");

        assertThat(eventsAt(Level.INFO, "attempt_start")).extracting(ILoggingEvent::getFormattedMessage)
            .containsExactly("event=attempt_start algorithm=A", "event=attempt_start algorithm=B");
        assertThat(eventsAt(Level.INFO, "attempt_result")).hasSize(2);

        List<ILoggingEvent> decisions = eventsAt(Level.INFO, "decision");
        assertThat(decisions).hasSize(1);
        assertThat(decisions.get(0).getFormattedMessage())
            .contains("algorithm=B", "status=accepted", "score=0.920", "inlier_ratio=0.750");
    }
}
