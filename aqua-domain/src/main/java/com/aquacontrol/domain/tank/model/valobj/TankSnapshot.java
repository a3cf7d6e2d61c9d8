package com.aquacontrol.domain.tank.model.valobj;

import com.aquacontrol.types.enums.TankStatusEnum;
import com.aquacontrol.types.enums.TankTypeEnum;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 鱼池聚合在某一版本上的完整状态。
 * <p>
 * 既是快照表中持久化的内容，也是比较两个聚合状态是否一致的依据。
 * </p>
 */
public record TankSnapshot(TankId tankId,
                           long version,
                           String name,
                           TankCapacity capacity,
                           Location location,
                           TankTypeEnum tankType,
                           TankStatusEnum status,
                           WaterQualityParameters optimalParameters,
                           LocalDateTime lastMaintenanceDate,
                           LocalDateTime nextMaintenanceDate,
                           LocalDateTime createdAt,
                           LocalDateTime updatedAt,
                           List<SensorSnapshot> sensors) {

    public TankSnapshot {
        sensors = sensors == null ? List.of() : List.copyOf(sensors);
    }
}
