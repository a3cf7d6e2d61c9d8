package com.aquacontrol.types.exception;

import com.aquacontrol.types.enums.ResponseCode;

/**
 * 事件流无法重建聚合：缺少创建事件、版本不连续或事件结构损坏。
 * <p>
 * 属于致命错误，不会被自动重试。
 * </p>
 */
public class ReconstructionException extends AppException {

    private static final long serialVersionUID = 1502286541729938473L;

    public ReconstructionException(String message) {
        super(ResponseCode.RECONSTRUCTION_FAILED.getCode(), message);
    }

    public ReconstructionException(String message, Throwable cause) {
        super(ResponseCode.RECONSTRUCTION_FAILED.getCode(), message, cause);
    }
}
