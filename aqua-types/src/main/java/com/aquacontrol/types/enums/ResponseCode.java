package com.aquacontrol.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 * <p>
 * 定义领域命令、仓储与事件存储抛出的异常码和对应描述信息。
 * </p>
 *
 * @author aquacontrol
 * @since 2025-03-02
 */
@Getter
public enum ResponseCode {

    /** 成功 */
    SUCCESS("0000", "成功"),

    /** 未知错误 */
    UN_ERROR("0001", "未知失败"),

    /** 非法参数 */
    ILLEGAL_PARAMETER("0002", "非法参数"),

    /** 违反业务不变量 */
    INVARIANT_VIOLATION("0003", "违反业务规则"),

    /** 乐观并发冲突 */
    CONCURRENCY_CONFLICT("0004", "并发冲突，请重新加载后重试"),

    /** 事件流重建失败 */
    RECONSTRUCTION_FAILED("0005", "聚合重建失败"),

    /** 聚合不存在 */
    NOT_FOUND("0006", "资源不存在");

    private final String code;
    private final String info;

    ResponseCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

}
