package com.aquacontrol.test.integration;

import com.aquacontrol.Application;
import com.aquacontrol.domain.tank.adapter.repository.ITankEventStore;
import com.aquacontrol.domain.tank.adapter.repository.ITankReadModelRepository;
import com.aquacontrol.domain.tank.adapter.repository.ITankRepository;
import com.aquacontrol.domain.tank.model.aggregate.TankAggregate;
import com.aquacontrol.domain.tank.model.entity.TankReadModelEntity;
import com.aquacontrol.domain.tank.model.event.TankEvent;
import com.aquacontrol.domain.tank.model.valobj.Location;
import com.aquacontrol.domain.tank.model.valobj.StoredTankEvent;
import com.aquacontrol.domain.tank.model.valobj.TankCapacity;
import com.aquacontrol.domain.tank.model.valobj.TankId;
import com.aquacontrol.test.support.TankFixtures;
import com.aquacontrol.trigger.application.command.TankCommandService;
import com.aquacontrol.trigger.application.command.TankCommandService.TankCommandResult;
import com.aquacontrol.types.enums.SensorTypeEnum;
import com.aquacontrol.types.enums.TankStatusEnum;
import com.aquacontrol.types.enums.TankTypeEnum;
import com.aquacontrol.types.exception.ConcurrencyException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfSystemProperty;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

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

@SpringBootTest(
        classes = Application.class,
        webEnvironment = SpringBootTest.WebEnvironment.NONE,
        properties = {
                "aqua.event-sourcing.snapshot-threshold=3"
        }
)
@EnabledIfSystemProperty(named = "it.docker.enabled", matches = "true")
public class TankEventStoreIntegrationTest extends PostgresIntegrationTestSupport {

    @Autowired
    private TankCommandService tankCommandService;

    @Autowired
    private ITankRepository tankRepository;

    @Autowired
    private ITankEventStore tankEventStore;

    @Autowired
    private ITankReadModelRepository tankReadModelRepository;

    @Test
    public void shouldPersistCommandsAndProjectReadModel() {
        TankCommandResult created = tankCommandService.createTank("Tank A", TankCapacity.liters(1000),
                Location.of("Hatchery", "R1"), TankTypeEnum.FRESHWATER);
        TankId tankId = created.tankId();
        tankCommandService.addSensor(tankId, SensorTypeEnum.TEMPERATURE, "T-100", "Acme", "SN-1",
                BigDecimal.valueOf(98));
        tankCommandService.activate(tankId);

        TankAggregate loaded = tankRepository.load(tankId).orElseThrow();
        Assertions.assertEquals(TankStatusEnum.ACTIVE, loaded.getStatus());
        Assertions.assertEquals(3, loaded.getVersion());
        Assertions.assertEquals(3, tankEventStore.currentVersion(tankId));

        TankReadModelEntity readModel = tankReadModelRepository.findById(tankId.toString());
        Assertions.assertEquals("active", readModel.getStatus());
        Assertions.assertEquals(1, readModel.getSensorCount());
        Assertions.assertEquals(3L, readModel.getVersion());
        Assertions.assertEquals(1, tankReadModelRepository.findByName("tank").size());
    }

    @Test
    public void shouldRestoreFromSnapshotWrittenAtThreshold() {
        TankAggregate tank = TankFixtures.newTank("Tank A");
        tank.addSensor(TankFixtures.sensor(SensorTypeEnum.PH));
        tank.addSensor(TankFixtures.sensor(SensorTypeEnum.SALINITY));
        tankRepository.save(tank);

        TankAggregate firstLoad = tankRepository.load(tank.getTankId()).orElseThrow();
        Assertions.assertTrue(tankEventStore.readSnapshot(tank.getTankId()).isPresent());

        TankAggregate fromSnapshot = tankRepository.load(tank.getTankId()).orElseThrow();
        Assertions.assertEquals(firstLoad.toSnapshot(), fromSnapshot.toSnapshot());
    }

    @Test
    public void shouldLetOnlyOneAppendWinPerVersion() throws Exception {
        TankAggregate tank = TankFixtures.newTank("Tank A");
        tankRepository.save(tank);
        TankId tankId = tank.getTankId();

        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (int i = 0; i < 4; i++) {
                String newName = "Writer " + i;
                results.add(pool.submit(() -> {
                    start.await(2, TimeUnit.SECONDS);
                    TankEvent event = new TankEvent.TankNameChanged(UUID.randomUUID(), tankId,
                            LocalDateTime.now(), "Tank A", newName);
                    try {
                        tankEventStore.append(tankId, List.of(event), 1);
                        return true;
                    } catch (ConcurrencyException ex) {
                        return false;
                    }
                }));
            }
            start.countDown();
            int winners = 0;
            for (Future<Boolean> result : results) {
                if (result.get(10, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            Assertions.assertEquals(1, winners);
            Assertions.assertEquals(2, tankEventStore.currentVersion(tankId));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    public void shouldSkipUnknownEventRowsOnLoad() {
        TankAggregate tank = TankFixtures.newTank("Tank A");
        tankRepository.save(tank);
        jdbcTemplate.update("INSERT INTO tank_event (event_id, aggregate_id, aggregate_type, version, event_type, "
                        + "payload, occurred_at) VALUES (?, ?, 'Tank', 2, 'TankPainted', '{\"color\":\"blue\"}'::jsonb, ?)",
                UUID.randomUUID().toString(), tank.getTankId().toString(), LocalDateTime.now());

        List<StoredTankEvent> events = tankEventStore.readEvents(tank.getTankId(), 0);
        Assertions.assertInstanceOf(TankEvent.UnknownTankEvent.class, events.get(1).event());

        TankAggregate loaded = tankRepository.load(tank.getTankId()).orElseThrow();
        Assertions.assertEquals(2, loaded.getVersion());
        Assertions.assertEquals("Tank A", loaded.getName());
    }
}
