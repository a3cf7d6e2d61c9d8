package com.aquacontrol.infrastructure.repository.tank;

import com.aquacontrol.domain.tank.adapter.repository.ITankReadModelRepository;
import com.aquacontrol.domain.tank.model.entity.TankReadModelEntity;
import com.aquacontrol.infrastructure.dao.TankReadModelDao;
import com.aquacontrol.infrastructure.dao.po.TankReadModelPO;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Repository;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 鱼池读模型仓储实现。
 */
@Repository
public class TankReadModelRepositoryImpl implements ITankReadModelRepository {

    private final TankReadModelDao tankReadModelDao;

    public TankReadModelRepositoryImpl(TankReadModelDao tankReadModelDao) {
        this.tankReadModelDao = tankReadModelDao;
    }

    @Override
    public void upsert(TankReadModelEntity entity) {
        tankReadModelDao.upsert(toPO(entity));
    }

    @Override
    public TankReadModelEntity findById(String tankId) {
        if (StringUtils.isBlank(tankId)) {
            return null;
        }
        return toEntity(tankReadModelDao.selectById(tankId));
    }

    @Override
    public List<TankReadModelEntity> findByName(String name) {
        if (StringUtils.isBlank(name)) {
            return Collections.emptyList();
        }
        List<TankReadModelPO> rows = tankReadModelDao.selectByNameLike(name.trim());
        if (rows == null || rows.isEmpty()) {
            return Collections.emptyList();
        }
        return rows.stream().map(this::toEntity).collect(Collectors.toList());
    }

    private TankReadModelEntity toEntity(TankReadModelPO po) {
        if (po == null) {
            return null;
        }
        TankReadModelEntity entity = new TankReadModelEntity();
        entity.setTankId(po.getTankId());
        entity.setName(po.getName());
        entity.setCapacityValue(po.getCapacityValue());
        entity.setCapacityUnit(po.getCapacityUnit());
        entity.setBuilding(po.getBuilding());
        entity.setRoom(po.getRoom());
        entity.setZone(po.getZone());
        entity.setLatitude(po.getLatitude());
        entity.setLongitude(po.getLongitude());
        entity.setTankType(po.getTankType());
        entity.setStatus(po.getStatus());
        entity.setSensorCount(po.getSensorCount());
        entity.setActiveSensorCount(po.getActiveSensorCount());
        entity.setLastMaintenanceDate(po.getLastMaintenanceDate());
        entity.setNextMaintenanceDate(po.getNextMaintenanceDate());
        entity.setVersion(po.getVersion());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    private TankReadModelPO toPO(TankReadModelEntity entity) {
        return TankReadModelPO.builder()
                .tankId(entity.getTankId())
                .name(entity.getName())
                .capacityValue(entity.getCapacityValue())
                .capacityUnit(entity.getCapacityUnit())
                .building(entity.getBuilding())
                .room(entity.getRoom())
                .zone(entity.getZone())
                .latitude(entity.getLatitude())
                .longitude(entity.getLongitude())
                .tankType(entity.getTankType())
                .status(entity.getStatus())
                .sensorCount(entity.getSensorCount())
                .activeSensorCount(entity.getActiveSensorCount())
                .lastMaintenanceDate(entity.getLastMaintenanceDate())
                .nextMaintenanceDate(entity.getNextMaintenanceDate())
                .version(entity.getVersion())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
