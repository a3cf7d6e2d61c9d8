package com.aquacontrol.types.exception;

import com.aquacontrol.types.enums.ResponseCode;

/**
 * 输入合法但违反聚合的业务不变量，例如无在线传感器时启用鱼池、超过传感器上限。
 * <p>
 * 仅影响当前命令调用，聚合状态保持不变，不会被自动重试。
 * </p>
 */
public class InvariantViolationException extends AppException {

    private static final long serialVersionUID = 8043387468113729754L;

    public InvariantViolationException(String message) {
        super(ResponseCode.INVARIANT_VIOLATION.getCode(), message);
    }
}
