package com.aquacontrol.domain.tank.adapter.repository;

import com.aquacontrol.domain.tank.model.event.TankEvent;
import com.aquacontrol.domain.tank.model.valobj.StoredTankEvent;
import com.aquacontrol.domain.tank.model.valobj.TankId;
import com.aquacontrol.domain.tank.model.valobj.TankSnapshot;

import java.util.List;
import java.util.Optional;

/**
 * 鱼池事件存储接口（只追加）
 *
 * @author aquacontrol
 * @since 2025-03-02
 */
public interface ITankEventStore {

    /**
     * 原子追加事件：当前版本必须等于 expectedVersion，否则抛出
     * {@link com.aquacontrol.types.exception.ConcurrencyException} 且不写入任何事件。
     *
     * @return 追加后的版本
     */
    long append(TankId tankId, List<TankEvent> events, long expectedVersion);

    /**
     * 读取版本严格大于 fromVersion 的事件，按版本升序。
     */
    List<StoredTankEvent> readEvents(TankId tankId, long fromVersion);

    /**
     * 读取最新快照
     */
    Optional<TankSnapshot> readSnapshot(TankId tankId);

    /**
     * 写入快照，后写覆盖先写
     */
    void writeSnapshot(TankSnapshot snapshot);

    /**
     * 当前版本，不存在时为 0
     */
    long currentVersion(TankId tankId);
}
