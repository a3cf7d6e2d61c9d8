package com.aquacontrol.test.domain;

import com.aquacontrol.domain.tank.model.aggregate.TankAggregate;
import com.aquacontrol.domain.tank.model.entity.SensorEntity;
import com.aquacontrol.domain.tank.model.event.TankEvent;
import com.aquacontrol.domain.tank.model.valobj.StoredTankEvent;
import com.aquacontrol.domain.tank.model.valobj.TankId;
import com.aquacontrol.domain.tank.model.valobj.TankSnapshot;
import com.aquacontrol.infrastructure.repository.tank.TankRepositoryImpl;
import com.aquacontrol.test.support.InMemoryTankEventStore;
import com.aquacontrol.test.support.TankFixtures;
import com.aquacontrol.types.common.Constants;
import com.aquacontrol.types.enums.SensorTypeEnum;
import com.aquacontrol.types.enums.TankStatusEnum;
import com.aquacontrol.types.exception.ConcurrencyException;
import com.aquacontrol.types.exception.InvariantViolationException;
import com.aquacontrol.types.exception.ReconstructionException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

public class TankRepositoryTest {

    private InMemoryTankEventStore eventStore;
    private TankRepositoryImpl repository;

    @BeforeEach
    public void setUp() {
        eventStore = new InMemoryTankEventStore();
        repository = new TankRepositoryImpl(eventStore, Constants.DEFAULT_SNAPSHOT_THRESHOLD);
    }

    @Test
    public void shouldLoadSavedStateAndClearPendingEvents() {
        TankAggregate tank = TankFixtures.newTank("Tank A");
        tank.addSensor(TankFixtures.temperatureSensor());
        tank.activate();

        repository.save(tank);

        Assertions.assertFalse(tank.hasPendingEvents());
        TankAggregate loaded = repository.load(tank.getTankId()).orElseThrow();
        Assertions.assertEquals(tank.toSnapshot(), loaded.toSnapshot());
        Assertions.assertFalse(loaded.hasPendingEvents());
        Assertions.assertTrue(repository.exists(tank.getTankId()));
    }

    @Test
    public void shouldReloadSameStateAfterEveryCommandSequence() {
        TankAggregate tank = TankFixtures.newTank("Tank A");
        repository.save(tank);
        Assertions.assertThrows(InvariantViolationException.class, tank::activate);
        repository.save(tank);
        Assertions.assertEquals(TankStatusEnum.INACTIVE,
                repository.load(tank.getTankId()).orElseThrow().getStatus());

        SensorEntity sensor = TankFixtures.temperatureSensor();
        tank.addSensor(sensor);
        tank.activate();
        tank.rename("Tank B");
        LocalDateTime scheduled = LocalDateTime.now().plusDays(5);
        tank.scheduleMaintenance(scheduled);
        tank.scheduleMaintenance(scheduled);
        tank.deactivateSensor(sensor.getSensorId(), "swap");
        repository.save(tank);

        TankAggregate loaded = repository.load(tank.getTankId()).orElseThrow();
        Assertions.assertEquals(tank.toSnapshot(), loaded.toSnapshot());
        Assertions.assertEquals(tank.getVersion(), eventStore.currentVersion(tank.getTankId()));
        Assertions.assertEquals(tank.getVersion(), loaded.getVersion());
    }

    @Test
    public void shouldReturnEmptyForUnknownTank() {
        TankId missing = TankId.generate();

        Assertions.assertTrue(repository.load(missing).isEmpty());
        Assertions.assertFalse(repository.exists(missing));
    }

    @Test
    public void shouldPersistWithoutClearingPendingEvents() {
        TankAggregate tank = TankFixtures.newTank("Tank A");

        Assertions.assertEquals(1, repository.persist(tank));
        Assertions.assertTrue(tank.hasPendingEvents());
        Assertions.assertEquals(1, eventStore.currentVersion(tank.getTankId()));

        tank.markEventsCommitted();
        Assertions.assertEquals(0, repository.persist(tank));
    }

    @Test
    public void shouldAppendOnlyNewEventsOnSubsequentSave() {
        TankAggregate tank = TankFixtures.newTank("Tank A");
        repository.save(tank);

        TankAggregate loaded = repository.load(tank.getTankId()).orElseThrow();
        loaded.rename("Tank B");
        repository.save(loaded);

        Assertions.assertEquals(2, eventStore.currentVersion(tank.getTankId()));
        Assertions.assertEquals("Tank B", repository.load(tank.getTankId()).orElseThrow().getName());
    }

    @Test
    public void shouldRestoreSameStateFromSnapshotAndFullReplay() {
        TankAggregate tank = TankFixtures.newTank("Tank A");
        tank.addSensor(TankFixtures.temperatureSensor());
        repository.save(tank);
        eventStore.writeSnapshot(repository.load(tank.getTankId()).orElseThrow().toSnapshot());

        TankAggregate loaded = repository.load(tank.getTankId()).orElseThrow();
        loaded.activate();
        repository.save(loaded);

        TankAggregate fromSnapshot = repository.load(tank.getTankId()).orElseThrow();
        List<TankEvent> history = new ArrayList<>();
        for (StoredTankEvent stored : eventStore.readEvents(tank.getTankId(), 0)) {
            history.add(stored.event());
        }
        TankAggregate fullReplay = TankAggregate.replay(history);

        Assertions.assertEquals(TankStatusEnum.ACTIVE, fromSnapshot.getStatus());
        Assertions.assertEquals(3, fromSnapshot.getVersion());
        Assertions.assertEquals(fullReplay.toSnapshot(), fromSnapshot.toSnapshot());
    }

    @Test
    public void shouldWriteSnapshotWhenReplayReachesThreshold() {
        TankAggregate tank = TankFixtures.newTank("Tank A");
        for (int i = 0; i < Constants.DEFAULT_SNAPSHOT_THRESHOLD - 2; i++) {
            tank.addSensor(TankFixtures.sensor(SensorTypeEnum.SALINITY));
        }
        repository.save(tank);

        repository.load(tank.getTankId());
        Assertions.assertEquals(0, eventStore.getSnapshotWrites());

        TankAggregate loaded = repository.load(tank.getTankId()).orElseThrow();
        loaded.rename("Tank A2");
        repository.save(loaded);
        repository.load(tank.getTankId());

        Assertions.assertEquals(1, eventStore.getSnapshotWrites());
        TankSnapshot snapshot = eventStore.readSnapshot(tank.getTankId()).orElseThrow();
        Assertions.assertEquals(Constants.DEFAULT_SNAPSHOT_THRESHOLD, snapshot.version());

        // 快照之后只回放新事件，未达阈值不再写快照
        repository.load(tank.getTankId());
        Assertions.assertEquals(1, eventStore.getSnapshotWrites());
    }

    @Test
    public void shouldTolerateSnapshotWriteFailure() {
        TankRepositoryImpl eager = new TankRepositoryImpl(eventStore, 1);
        TankAggregate tank = TankFixtures.newTank("Tank A");
        eager.save(tank);
        eventStore.setFailSnapshotWrites(true);

        TankAggregate loaded = eager.load(tank.getTankId()).orElseThrow();

        Assertions.assertEquals("Tank A", loaded.getName());
        Assertions.assertTrue(eventStore.readSnapshot(tank.getTankId()).isEmpty());
    }

    @Test
    public void shouldFailWhenFirstEventIsNotTankCreated() {
        TankId tankId = TankId.generate();
        eventStore.appendRaw(tankId, new StoredTankEvent(1,
                new TankEvent.TankActivated(UUID.randomUUID(), tankId, LocalDateTime.now())));

        Assertions.assertThrows(ReconstructionException.class, () -> repository.load(tankId));
    }

    @Test
    public void shouldFailOnVersionGap() {
        TankAggregate tank = TankFixtures.newTank("Tank A");
        TankId tankId = tank.getTankId();
        eventStore.appendRaw(tankId, new StoredTankEvent(1, tank.getPendingEvents().get(0)));
        eventStore.appendRaw(tankId, new StoredTankEvent(3,
                new TankEvent.TankNameChanged(UUID.randomUUID(), tankId, LocalDateTime.now(), "Tank A", "Tank B")));

        Assertions.assertThrows(ReconstructionException.class, () -> repository.load(tankId));
    }

    @Test
    public void shouldLoadStreamContainingUnknownEvent() {
        TankAggregate tank = TankFixtures.newTank("Tank A");
        TankId tankId = tank.getTankId();
        eventStore.appendRaw(tankId, new StoredTankEvent(1, tank.getPendingEvents().get(0)));
        eventStore.appendRaw(tankId, new StoredTankEvent(2, new TankEvent.UnknownTankEvent(UUID.randomUUID(),
                tankId, LocalDateTime.now(), "TankPainted", "{}")));

        TankAggregate loaded = repository.load(tankId).orElseThrow();
        Assertions.assertEquals(2, loaded.getVersion());

        loaded.rename("Tank B");
        repository.save(loaded);
        Assertions.assertEquals(3, eventStore.currentVersion(tankId));
    }

    @Test
    public void shouldRejectSecondWriterFromSameVersion() {
        TankAggregate tank = TankFixtures.newTank("Tank A");
        repository.save(tank);
        TankAggregate first = repository.load(tank.getTankId()).orElseThrow();
        TankAggregate second = repository.load(tank.getTankId()).orElseThrow();

        first.rename("First");
        second.rename("Second");
        repository.save(first);

        ConcurrencyException ex = Assertions.assertThrows(ConcurrencyException.class, () -> repository.save(second));
        Assertions.assertEquals(1, ex.getExpectedVersion());
        Assertions.assertTrue(second.hasPendingEvents());
        Assertions.assertEquals("First", repository.load(tank.getTankId()).orElseThrow().getName());
    }

    @Test
    public void shouldLetExactlyOneConcurrentSaveWin() throws Exception {
        TankAggregate tank = TankFixtures.newTank("Tank A");
        repository.save(tank);
        int writers = 8;
        List<TankAggregate> copies = new ArrayList<>();
        for (int i = 0; i < writers; i++) {
            TankAggregate copy = repository.load(tank.getTankId()).orElseThrow();
            copy.rename("Writer " + i);
            copies.add(copy);
        }

        ExecutorService executor = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        for (TankAggregate copy : copies) {
            results.add(executor.submit(() -> {
                start.await();
                try {
                    repository.save(copy);
                    return true;
                } catch (ConcurrencyException ex) {
                    return false;
                }
            }));
        }
        start.countDown();
        int winners = 0;
        for (Future<Boolean> result : results) {
            if (result.get(5, TimeUnit.SECONDS)) {
                winners++;
            }
        }
        executor.shutdown();

        Assertions.assertEquals(1, winners);
        Assertions.assertEquals(2, eventStore.currentVersion(tank.getTankId()));
    }

    @Test
    public void shouldRunTankLifecycleScenario() {
        TankAggregate tank = TankFixtures.newTank("Tank A");
        SensorEntity sensor = SensorEntity.create(SensorTypeEnum.TEMPERATURE, "T-100", "Acme", "SN-1",
                BigDecimal.valueOf(98));
        tank.addSensor(sensor);
        tank.activate();
        repository.save(tank);

        TankAggregate loaded = repository.load(tank.getTankId()).orElseThrow();
        Assertions.assertEquals(TankStatusEnum.ACTIVE, loaded.getStatus());
        Assertions.assertEquals(3, loaded.getVersion());
        Assertions.assertEquals(1, loaded.getSensorCount());
        Assertions.assertEquals(0, loaded.getSensors().get(0).getAccuracy().compareTo(BigDecimal.valueOf(98)));
    }

    @Test
    public void shouldKeepTenSensorsAfterRejectedEleventh() {
        TankAggregate tank = TankFixtures.newTank("Tank A");
        for (int i = 0; i < Constants.MAX_SENSORS_PER_TANK; i++) {
            tank.addSensor(TankFixtures.sensor(SensorTypeEnum.DISSOLVED_OXYGEN));
        }
        repository.save(tank);

        TankAggregate loaded = repository.load(tank.getTankId()).orElseThrow();
        Assertions.assertThrows(InvariantViolationException.class,
                () -> loaded.addSensor(TankFixtures.temperatureSensor()));
        repository.save(loaded);

        Assertions.assertEquals(Constants.MAX_SENSORS_PER_TANK,
                repository.load(tank.getTankId()).orElseThrow().getSensorCount());
    }

    @Test
    public void shouldRemoveSoleSensorOnlyAfterDeactivation() {
        TankAggregate tank = TankFixtures.newTank("Tank A");
        SensorEntity sensor = TankFixtures.temperatureSensor();
        tank.addSensor(sensor);
        tank.activate();
        repository.save(tank);

        TankAggregate loaded = repository.load(tank.getTankId()).orElseThrow();
        Assertions.assertThrows(InvariantViolationException.class, () -> loaded.removeSensor(sensor.getSensorId()));
        loaded.deactivateSensor(sensor.getSensorId(), "replace probe");
        loaded.removeSensor(sensor.getSensorId());
        repository.save(loaded);

        TankAggregate reloaded = repository.load(tank.getTankId()).orElseThrow();
        Assertions.assertEquals(0, reloaded.getSensorCount());
        Assertions.assertEquals(5, reloaded.getVersion());
    }
}
