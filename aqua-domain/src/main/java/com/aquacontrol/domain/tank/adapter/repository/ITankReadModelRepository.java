package com.aquacontrol.domain.tank.adapter.repository;

import com.aquacontrol.domain.tank.model.entity.TankReadModelEntity;

import java.util.List;

/**
 * 鱼池读模型仓储接口（列表查询用，不参与聚合重建）
 *
 * @author aquacontrol
 * @since 2025-03-02
 */
public interface ITankReadModelRepository {

    /**
     * 插入或按 ID 覆盖
     */
    void upsert(TankReadModelEntity entity);

    TankReadModelEntity findById(String tankId);

    List<TankReadModelEntity> findByName(String name);
}
