package com.edge.registration.core.registration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 多算法配准引擎
 * <p>
 * 按注册顺序依次尝试各算法：
 * 1. 第一个通过质量门限的结果立即被接受，后续算法不再执行
 * 2. 都不过关时，若启用降级则返回得分最高的结果（同分取先注册的），否则失败
 * 3. 所有算法都没有结果或抛异常时，直接失败
 * <p>
 * register 从不因质量问题抛异常，只通过 status 报告。
 * 引擎不是线程安全的，共享时由调用方串行化
 *
 * @param <I> 图像类型
 */
public class ImageRegistrationEngine<I> {
    private static final Logger defaultLogger = LoggerFactory.getLogger(ImageRegistrationEngine.class);

    // 插入顺序即评估顺序；覆盖注册保留原位置
    private final Map<String, RegistrationAlgorithm<I>> algorithms = new LinkedHashMap<>();
    private final EngineConfig config;
    private final Logger logger;

    public ImageRegistrationEngine(Map<String, ? extends RegistrationAlgorithm<I>> algorithms) {
        this(algorithms, null, null);
    }

    public ImageRegistrationEngine(Map<String, ? extends RegistrationAlgorithm<I>> algorithms, EngineConfig config) {
        this(algorithms, config, null);
    }

    /**
     * @param algorithms 名称 -> 算法，按迭代顺序复制；可以为空
     * @param config     验收策略，null 时使用默认值
     * @param logger     诊断日志，null 时使用本类的 logger
     */
    public ImageRegistrationEngine(Map<String, ? extends RegistrationAlgorithm<I>> algorithms,
                                   EngineConfig config,
                                   Logger logger) {
        this.config = config != null ? config : EngineConfig.defaults();
        this.logger = logger != null ? logger : defaultLogger;
        if (algorithms != null) {
            for (Map.Entry<String, ? extends RegistrationAlgorithm<I>> entry : algorithms.entrySet()) {
                registerAlgorithm(entry.getKey(), entry.getValue());
            }
        }
    }

    /**
     * 注册算法；同名时替换实现但保留原来的评估位置
     */
    public void registerAlgorithm(String name, RegistrationAlgorithm<I> algorithm) {
        if (name == null) {
            throw new IllegalArgumentException("Algorithm name cannot be null");
        }
        if (algorithm == null) {
            throw new IllegalArgumentException("Algorithm cannot be null: " + name);
        }
        RegistrationAlgorithm<I> previous = algorithms.put(name, algorithm);
        logger.debug("event=algorithm_registered algorithm={} replaced={}", name, previous != null);
    }

    /**
     * 移除算法，不存在时忽略
     */
    public void unregisterAlgorithm(String name) {
        if (algorithms.remove(name) != null) {
            logger.debug("event=algorithm_unregistered algorithm={}", name);
        }
    }

    public List<String> getAlgorithmNames() {
        return Collections.unmodifiableList(new ArrayList<>(algorithms.keySet()));
    }

    public boolean hasAlgorithm(String name) {
        return algorithms.containsKey(name);
    }

    public int size() {
        return algorithms.size();
    }

    public EngineConfig getConfig() {
        return config;
    }

    /**
     * 使用引擎自身的验收策略配准
     */
    public RegistrationOutput register(I source, I reference) {
        return register(source, reference, config);
    }

    /**
     * 使用指定的验收策略配准（单次覆盖）
     *
     * @param source    源图
     * @param reference 参考图
     * @param policy    本次调用的验收策略，null 时使用引擎默认策略
     * @return 配准决策，不会为 null
     */
    public RegistrationOutput register(I source, I reference, EngineConfig policy) {
        EngineConfig effective = policy != null ? policy : config;
        List<RegistrationAttempt> attempts = new ArrayList<>();

        if (algorithms.isEmpty()) {
            logger.warn("event=decision algorithm=none status={} reason=no_algorithms",
                RegistrationStatus.FAILED.getValue());
            return RegistrationOutput.failed(attempts);
        }

        String bestAlgorithm = null;
        RegistrationResult bestResult = null;

        for (Map.Entry<String, RegistrationAlgorithm<I>> entry : algorithms.entrySet()) {
            String name = entry.getKey();
            logger.info("event=attempt_start algorithm={}", name);

            Optional<RegistrationResult> candidate;
            try {
                candidate = entry.getValue().align(source, reference);
            } catch (VirtualMachineError e) {
                throw e;
            } catch (Throwable e) {
                // 包括 LinkageError：某个算法缺少本地库不应中断其他算法
                logger.warn("event=attempt_fault algorithm={} error={}", name, e.getMessage(), e);
                attempts.add(RegistrationAttempt.faulted(name, e));
                continue;
            }

            if (candidate == null || candidate.isEmpty()) {
                logger.info("event=attempt_result algorithm={} outcome=no_result", name);
                attempts.add(RegistrationAttempt.noResult(name));
                continue;
            }

            RegistrationResult result = candidate.get();
            boolean acceptable = isAcceptable(result, effective);
            logger.info("event=attempt_result algorithm={} outcome=result score={} inlier_ratio={} matches={} passed_gate={}",
                name, format(result.getScore()), format(result.getInlierRatio()),
                result.getMatchesCount(), acceptable);

            if (acceptable) {
                attempts.add(RegistrationAttempt.accepted(name, result));
                logDecision(RegistrationStatus.ACCEPTED, name, result);
                return RegistrationOutput.accepted(name, result, attempts);
            }

            attempts.add(RegistrationAttempt.rejected(name, result));
            // 严格大于：同分时保留先注册的算法
            if (bestResult == null || result.getScore() > bestResult.getScore()) {
                bestResult = result;
                bestAlgorithm = name;
            }
        }

        if (bestResult == null) {
            logger.warn("event=decision algorithm=none status={} reason=no_valid_result attempts={}",
                RegistrationStatus.FAILED.getValue(), attempts.size());
            return RegistrationOutput.failed(attempts);
        }

        if (!effective.isEnableFallback()) {
            logger.warn("event=decision algorithm=none status={} reason=below_threshold best_algorithm={} best_score={} min_score={} min_inlier_ratio={}",
                RegistrationStatus.FAILED.getValue(), bestAlgorithm, format(bestResult.getScore()),
                format(effective.getMinScore()), format(effective.getMinInlierRatio()));
            return RegistrationOutput.failed(attempts);
        }

        logDecision(RegistrationStatus.FALLBACK, bestAlgorithm, bestResult);
        return RegistrationOutput.fallback(bestAlgorithm, bestResult, attempts);
    }

    private boolean isAcceptable(RegistrationResult result, EngineConfig policy) {
        return result.getScore() >= policy.getMinScore()
            && result.getInlierRatio() >= policy.getMinInlierRatio();
    }

    private void logDecision(RegistrationStatus status, String algorithm, RegistrationResult result) {
        logger.info("event=decision algorithm={} status={} score={} inlier_ratio={}",
            algorithm, status.getValue(), format(result.getScore()), format(result.getInlierRatio()));
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.3f", value);
    }
}
