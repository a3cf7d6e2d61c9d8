package com.aquacontrol.types.exception;

import com.aquacontrol.types.enums.ResponseCode;
import lombok.Getter;

/**
 * 追加事件时期望版本与存储中的当前版本不一致。
 * <p>
 * 调用方需要重新加载聚合并从头重试命令。
 * </p>
 */
@Getter
public class ConcurrencyException extends AppException {

    private static final long serialVersionUID = -4750195329931880474L;

    private final String aggregateId;
    private final long expectedVersion;
    private final long actualVersion;

    public ConcurrencyException(String aggregateId, long expectedVersion, long actualVersion) {
        super(ResponseCode.CONCURRENCY_CONFLICT.getCode(),
                "Concurrency conflict for aggregate " + aggregateId
                        + ": expected version " + expectedVersion
                        + ", but current version is " + actualVersion);
        this.aggregateId = aggregateId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public ConcurrencyException(String aggregateId, long expectedVersion, Throwable cause) {
        super(ResponseCode.CONCURRENCY_CONFLICT.getCode(),
                "Concurrency conflict for aggregate " + aggregateId
                        + ": version " + (expectedVersion + 1) + " was appended by another writer",
                cause);
        this.aggregateId = aggregateId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = -1L;
    }
}
