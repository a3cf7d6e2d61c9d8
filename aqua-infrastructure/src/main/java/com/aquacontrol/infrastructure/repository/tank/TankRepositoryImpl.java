package com.aquacontrol.infrastructure.repository.tank;

import com.aquacontrol.domain.tank.adapter.repository.ITankEventStore;
import com.aquacontrol.domain.tank.adapter.repository.ITankRepository;
import com.aquacontrol.domain.tank.model.aggregate.TankAggregate;
import com.aquacontrol.domain.tank.model.event.TankEvent;
import com.aquacontrol.domain.tank.model.valobj.StoredTankEvent;
import com.aquacontrol.domain.tank.model.valobj.TankId;
import com.aquacontrol.domain.tank.model.valobj.TankSnapshot;
import com.aquacontrol.types.exception.ReconstructionException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * 事件溯源的鱼池仓储实现。
 * <p>
 * 加载流程：读取快照（没有则从版本 0 开始）→ 读取快照之后的事件 → 校验版本连续 → 回放；
 * 本次回放的事件数达到阈值时补写一份快照，快照写入失败只记日志。
 * 由配置类按 {@code aqua.event-sourcing.snapshot-threshold} 创建。
 * </p>
 *
 * @author aquacontrol
 * @since 2025-03-02
 */
@Slf4j
public class TankRepositoryImpl implements ITankRepository {

    private final ITankEventStore tankEventStore;
    private final int snapshotThreshold;

    public TankRepositoryImpl(ITankEventStore tankEventStore, int snapshotThreshold) {
        this.tankEventStore = tankEventStore;
        this.snapshotThreshold = Math.max(snapshotThreshold, 1);
    }

    @Override
    public Optional<TankAggregate> load(TankId tankId) {
        Optional<TankSnapshot> snapshot = tankEventStore.readSnapshot(tankId);
        long fromVersion = snapshot.map(TankSnapshot::version).orElse(0L);
        List<StoredTankEvent> events = tankEventStore.readEvents(tankId, fromVersion);
        if (snapshot.isEmpty() && events.isEmpty()) {
            return Optional.empty();
        }
        if (snapshot.isEmpty() && !(events.get(0).event() instanceof TankEvent.TankCreated)) {
            throw new ReconstructionException("First event of tank " + tankId + " must be TankCreated, but was "
                    + events.get(0).event().eventName());
        }
        long expected = fromVersion;
        for (StoredTankEvent stored : events) {
            if (stored.version() != expected + 1) {
                throw new ReconstructionException("Non-contiguous event versions for tank " + tankId
                        + ": expected " + (expected + 1) + " but found " + stored.version());
            }
            expected = stored.version();
        }

        TankAggregate tank = TankAggregate.rehydrate(snapshot.orElse(null), events);
        log.debug("Tank loaded. tankId={}, snapshotVersion={}, replayed={}, version={}",
                tankId, fromVersion, events.size(), tank.getVersion());

        if (events.size() >= snapshotThreshold) {
            try {
                tankEventStore.writeSnapshot(tank.toSnapshot());
            } catch (RuntimeException ex) {
                log.warn("Tank snapshot write failed. tankId={}, version={}, error={}",
                        tankId, tank.getVersion(), ex.getMessage());
            }
        }
        return Optional.of(tank);
    }

    @Override
    public void save(TankAggregate tank) {
        if (persist(tank) > 0) {
            tank.markEventsCommitted();
        }
    }

    @Override
    public int persist(TankAggregate tank) {
        if (!tank.hasPendingEvents()) {
            return 0;
        }
        List<TankEvent> pending = tank.getPendingEvents();
        long newVersion = tankEventStore.append(tank.getTankId(), pending, tank.getPersistedVersion());
        log.info("Tank events saved. tankId={}, count={}, version={}", tank.getTankId(), pending.size(), newVersion);
        return pending.size();
    }

    @Override
    public boolean exists(TankId tankId) {
        return tankEventStore.currentVersion(tankId) > 0;
    }
}
