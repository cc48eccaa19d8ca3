package com.edge.registration.core.registration;

import java.util.Optional;

/**
 * 可插拔的配准算法
 *
 * @param <I> 图像类型，引擎本身不关心像素
 */
public interface RegistrationAlgorithm<I> {
    /**
     * 将源图对齐到参考图
     * <p>
     * 特征不足、找不到单应矩阵等普通失败应返回 {@link Optional#empty()}，不要抛异常；
     * 抛出的异常会被引擎当作算法故障记录并跳过
     *
     * @param source    源图
     * @param reference 参考图
     * @return 配准结果，无法对齐时为空
     */
    Optional<RegistrationResult> align(I source, I reference);

    /**
     * 算法名称，仅用于日志
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
