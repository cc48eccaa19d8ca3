package com.edge.registration.core.registration;

/**
 * 算法内部故障
 * <p>
 * 算法实现可以抛出此异常显式表示故障，引擎会像处理其他异常一样捕获并记录
 */
public class AlgorithmException extends RegistrationException {

    public AlgorithmException(String message) {
        super(message);
    }

    public AlgorithmException(String message, Throwable cause) {
        super(message, cause);
    }
}
