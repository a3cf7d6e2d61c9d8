/**
 * 鱼池领域事件。
 * <p>
 * 事件名（类型标签）见 {@link com.aquacontrol.types.enums.TankEventTypeEnum}，
 * 一旦写入事件日志就不能再修改。
 */
package com.aquacontrol.domain.tank.model.event;
