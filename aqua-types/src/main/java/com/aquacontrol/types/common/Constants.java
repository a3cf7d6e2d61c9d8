package com.aquacontrol.types.common;

/**
 * 全局常量定义类。
 * <p>
 * 定义鱼池聚合与事件存储共用的业务常量。
 * </p>
 *
 * @author aquacontrol
 * @since 2025-03-02
 */
public class Constants {

    /** 单个鱼池允许挂载的最大传感器数量 */
    public final static int MAX_SENSORS_PER_TANK = 10;

    /** 默认快照阈值：自上次快照以来回放的事件数达到该值时重写快照 */
    public final static int DEFAULT_SNAPSHOT_THRESHOLD = 10;

    /** 聚合类型标识，写入事件表与快照表 */
    public final static String TANK_AGGREGATE_TYPE = "Tank";

}
