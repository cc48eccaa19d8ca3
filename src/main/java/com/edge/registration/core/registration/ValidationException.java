package com.edge.registration.core.registration;

/**
 * 值对象校验失败（分数、内点率越界，匹配数为负等）
 * <p>
 * 在构造时立即抛出，不做任何截断修正
 */
public class ValidationException extends RegistrationException {

    public ValidationException(String message) {
        super(message);
    }
}
