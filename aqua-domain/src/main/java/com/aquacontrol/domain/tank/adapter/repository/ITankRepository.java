package com.aquacontrol.domain.tank.adapter.repository;

import com.aquacontrol.domain.tank.model.aggregate.TankAggregate;
import com.aquacontrol.domain.tank.model.valobj.TankId;

import java.util.Optional;

/**
 * 鱼池聚合仓储接口（基于事件溯源）
 *
 * @author aquacontrol
 * @since 2025-03-02
 */
public interface ITankRepository {

    /**
     * 由快照与后续事件重建聚合
     */
    Optional<TankAggregate> load(TankId tankId);

    /**
     * 以持久化版本为期望版本追加待提交事件，成功后清空待提交事件
     */
    void save(TankAggregate tank);

    /**
     * 仅追加待提交事件，不清空（由工作单元在发布后清空）
     *
     * @return 追加的事件数
     */
    int persist(TankAggregate tank);

    boolean exists(TankId tankId);
}
