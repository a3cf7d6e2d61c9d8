package com.aquacontrol.infrastructure.dao;

import com.aquacontrol.infrastructure.dao.po.TankEventPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 鱼池事件 DAO。
 */
@Mapper
public interface TankEventDao {

    /**
     * 单条语句批量插入，(aggregate_id, version) 唯一键冲突时整体失败。
     */
    int insertBatch(@Param("events") List<TankEventPO> events);

    List<TankEventPO> selectByAggregateIdAfterVersion(@Param("aggregateId") String aggregateId,
                                                      @Param("fromVersion") Long fromVersion);

    /**
     * 当前最大版本，无事件时返回 0。
     */
    Long selectMaxVersion(@Param("aggregateId") String aggregateId);
}
