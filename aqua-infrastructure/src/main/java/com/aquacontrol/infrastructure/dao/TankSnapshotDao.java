package com.aquacontrol.infrastructure.dao;

import com.aquacontrol.infrastructure.dao.po.TankSnapshotPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

/**
 * 鱼池快照 DAO。
 */
@Mapper
public interface TankSnapshotDao {

    int upsert(TankSnapshotPO po);

    TankSnapshotPO selectByAggregateId(@Param("aggregateId") String aggregateId);
}
