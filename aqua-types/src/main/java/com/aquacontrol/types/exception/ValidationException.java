package com.aquacontrol.types.exception;

import com.aquacontrol.types.enums.ResponseCode;

/**
 * 命令参数校验失败：空名称、数值越界、日期不满足先后关系等。
 * <p>
 * 仅影响当前命令调用，聚合状态保持不变。
 * </p>
 */
public class ValidationException extends AppException {

    private static final long serialVersionUID = -2160434930815442291L;

    public ValidationException(String message) {
        super(ResponseCode.ILLEGAL_PARAMETER.getCode(), message);
    }
}
