package com.aquacontrol.infrastructure.dao;

import com.aquacontrol.infrastructure.dao.po.TankReadModelPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 鱼池读模型 DAO。
 */
@Mapper
public interface TankReadModelDao {

    int upsert(TankReadModelPO po);

    TankReadModelPO selectById(@Param("tankId") String tankId);

    List<TankReadModelPO> selectByNameLike(@Param("name") String name);
}
