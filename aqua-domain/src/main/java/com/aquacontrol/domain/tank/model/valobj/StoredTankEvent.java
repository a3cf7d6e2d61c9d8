package com.aquacontrol.domain.tank.model.valobj;

import com.aquacontrol.domain.tank.model.event.TankEvent;

/**
 * 事件日志中的一条记录：追加时分配的版本号及其事件。
 */
public record StoredTankEvent(long version, TankEvent event) {
}
