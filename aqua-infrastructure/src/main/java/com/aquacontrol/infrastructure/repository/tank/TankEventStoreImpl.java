package com.aquacontrol.infrastructure.repository.tank;

import com.aquacontrol.domain.tank.adapter.repository.ITankEventStore;
import com.aquacontrol.domain.tank.model.event.TankEvent;
import com.aquacontrol.domain.tank.model.valobj.StoredTankEvent;
import com.aquacontrol.domain.tank.model.valobj.TankId;
import com.aquacontrol.domain.tank.model.valobj.TankSnapshot;
import com.aquacontrol.infrastructure.dao.TankEventDao;
import com.aquacontrol.infrastructure.dao.TankSnapshotDao;
import com.aquacontrol.infrastructure.dao.po.TankEventPO;
import com.aquacontrol.infrastructure.dao.po.TankSnapshotPO;
import com.aquacontrol.types.common.Constants;
import com.aquacontrol.types.exception.AppException;
import com.aquacontrol.types.exception.ConcurrencyException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 鱼池事件存储实现（PostgreSQL + MyBatis）。
 * <p>
 * 追加前先比对当前最大版本与期望版本；两个写入方同时通过比对时，
 * 由 (aggregate_id, version) 唯一键兜底，后到者的整条批量插入失败并转换为并发冲突。
 * </p>
 *
 * @author aquacontrol
 * @since 2025-03-02
 */
@Slf4j
@Repository
public class TankEventStoreImpl implements ITankEventStore {

    private final TankEventDao tankEventDao;
    private final TankSnapshotDao tankSnapshotDao;
    private final TankEventSerializer tankEventSerializer;

    public TankEventStoreImpl(TankEventDao tankEventDao,
                              TankSnapshotDao tankSnapshotDao,
                              TankEventSerializer tankEventSerializer) {
        this.tankEventDao = tankEventDao;
        this.tankSnapshotDao = tankSnapshotDao;
        this.tankEventSerializer = tankEventSerializer;
    }

    @Override
    public long append(TankId tankId, List<TankEvent> events, long expectedVersion) {
        if (events == null || events.isEmpty()) {
            return expectedVersion;
        }
        String aggregateId = tankId.toString();
        long currentVersion = currentVersion(tankId);
        if (currentVersion != expectedVersion) {
            log.warn("Tank event append rejected. tankId={}, expectedVersion={}, currentVersion={}",
                    aggregateId, expectedVersion, currentVersion);
            throw new ConcurrencyException(aggregateId, expectedVersion, currentVersion);
        }

        List<TankEventPO> rows = new ArrayList<>(events.size());
        long version = expectedVersion;
        for (TankEvent event : events) {
            rows.add(tankEventSerializer.toPO(event, ++version));
        }
        try {
            tankEventDao.insertBatch(rows);
        } catch (DuplicateKeyException ex) {
            log.warn("Tank event append lost the race. tankId={}, expectedVersion={}", aggregateId, expectedVersion);
            throw new ConcurrencyException(aggregateId, expectedVersion, ex);
        }
        log.debug("Tank events appended. tankId={}, count={}, newVersion={}", aggregateId, rows.size(), version);
        return version;
    }

    @Override
    public List<StoredTankEvent> readEvents(TankId tankId, long fromVersion) {
        List<TankEventPO> rows = tankEventDao.selectByAggregateIdAfterVersion(tankId.toString(), fromVersion);
        if (rows == null || rows.isEmpty()) {
            return Collections.emptyList();
        }
        List<StoredTankEvent> events = new ArrayList<>(rows.size());
        for (TankEventPO row : rows) {
            events.add(tankEventSerializer.toStoredEvent(row));
        }
        return events;
    }

    /**
     * 快照只是缓存，解析失败时丢弃并回退到全量回放。
     */
    @Override
    public Optional<TankSnapshot> readSnapshot(TankId tankId) {
        TankSnapshotPO po = tankSnapshotDao.selectByAggregateId(tankId.toString());
        if (po == null) {
            return Optional.empty();
        }
        try {
            TankSnapshot snapshot = tankEventSerializer.readSnapshot(po.getPayload());
            if (snapshot == null || snapshot.version() != valueOf(po.getVersion())) {
                log.warn("Discard inconsistent tank snapshot. tankId={}, rowVersion={}", tankId, po.getVersion());
                return Optional.empty();
            }
            return Optional.of(snapshot);
        } catch (AppException ex) {
            log.warn("Discard unreadable tank snapshot. tankId={}, version={}, error={}",
                    tankId, po.getVersion(), ex.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void writeSnapshot(TankSnapshot snapshot) {
        LocalDateTime now = LocalDateTime.now();
        TankSnapshotPO po = TankSnapshotPO.builder()
                .aggregateId(snapshot.tankId().toString())
                .aggregateType(Constants.TANK_AGGREGATE_TYPE)
                .version(snapshot.version())
                .payload(tankEventSerializer.writeSnapshot(snapshot))
                .createdAt(now)
                .updatedAt(now)
                .build();
        tankSnapshotDao.upsert(po);
        log.info("Tank snapshot written. tankId={}, version={}", snapshot.tankId(), snapshot.version());
    }

    @Override
    public long currentVersion(TankId tankId) {
        return valueOf(tankEventDao.selectMaxVersion(tankId.toString()));
    }

    private long valueOf(Long value) {
        return value == null ? 0L : value;
    }
}
