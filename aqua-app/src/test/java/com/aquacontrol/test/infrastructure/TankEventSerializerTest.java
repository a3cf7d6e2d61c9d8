package com.aquacontrol.test.infrastructure;

import com.aquacontrol.config.JacksonConfig;
import com.aquacontrol.domain.tank.model.aggregate.TankAggregate;
import com.aquacontrol.domain.tank.model.entity.SensorEntity;
import com.aquacontrol.domain.tank.model.event.TankEvent;
import com.aquacontrol.domain.tank.model.valobj.Location;
import com.aquacontrol.domain.tank.model.valobj.StoredTankEvent;
import com.aquacontrol.domain.tank.model.valobj.TankCapacity;
import com.aquacontrol.domain.tank.model.valobj.TankSnapshot;
import com.aquacontrol.domain.tank.model.valobj.WaterQualityParameters;
import com.aquacontrol.infrastructure.dao.po.TankEventPO;
import com.aquacontrol.infrastructure.repository.tank.TankEventSerializer;
import com.aquacontrol.infrastructure.util.JsonCodec;
import com.aquacontrol.test.support.TankFixtures;
import com.aquacontrol.types.common.Constants;
import com.aquacontrol.types.enums.CapacityUnitEnum;
import com.aquacontrol.types.enums.SensorStatusEnum;
import com.aquacontrol.types.enums.SensorTypeEnum;
import com.aquacontrol.types.enums.TankEventTypeEnum;
import com.aquacontrol.types.exception.ReconstructionException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

public class TankEventSerializerTest {

    private TankEventSerializer serializer;

    @BeforeEach
    public void setUp() {
        serializer = new TankEventSerializer(new JsonCodec(new JacksonConfig().objectMapper()));
    }

    @Test
    public void shouldMapEveryEventTypeToEventClass() {
        for (TankEventTypeEnum type : TankEventTypeEnum.values()) {
            Assertions.assertNotNull(TankEventSerializer.eventClassOf(type), type.name());
        }
    }

    @Test
    public void shouldRestoreEventsWrittenByCommands() {
        List<TankEvent> history = fullHistory();
        Assertions.assertEquals(TankEventTypeEnum.values().length, distinctNames(history));

        long version = 0;
        for (TankEvent event : history) {
            TankEventPO po = serializer.toPO(event, ++version);
            Assertions.assertEquals(event.eventName(), po.getEventType());
            Assertions.assertEquals(Constants.TANK_AGGREGATE_TYPE, po.getAggregateType());
            Assertions.assertFalse(po.getPayload().contains("eventName"));

            StoredTankEvent stored = serializer.toStoredEvent(po);
            Assertions.assertEquals(version, stored.version());
            Assertions.assertEquals(event, stored.event());
        }
    }

    @Test
    public void shouldWriteEnumsAsCodes() {
        TankAggregate tank = TankFixtures.newTank("Tank A");
        TankEventPO po = serializer.toPO(tank.getPendingEvents().get(0), 1);

        Assertions.assertTrue(po.getPayload().contains("\"freshwater\""));
        Assertions.assertTrue(po.getPayload().contains("\"L\""));
    }

    @Test
    public void shouldTurnUnknownTagIntoUnknownEvent() {
        UUID eventId = UUID.randomUUID();
        TankEventPO po = TankEventPO.builder()
                .eventId(eventId.toString())
                .aggregateId(UUID.randomUUID().toString())
                .version(4L)
                .eventType("TankPainted")
                .payload("{\"color\":\"blue\"}")
                .occurredAt(LocalDateTime.now())
                .build();

        StoredTankEvent stored = serializer.toStoredEvent(po);

        TankEvent.UnknownTankEvent unknown = Assertions.assertInstanceOf(TankEvent.UnknownTankEvent.class, stored.event());
        Assertions.assertEquals("TankPainted", unknown.eventName());
        Assertions.assertEquals(eventId, unknown.eventId());
        Assertions.assertEquals("{\"color\":\"blue\"}", serializer.toPO(unknown, 4).getPayload());
    }

    @Test
    public void shouldRejectCorruptPayloadForKnownTag() {
        TankEventPO corrupt = TankEventPO.builder()
                .eventId(UUID.randomUUID().toString())
                .aggregateId(UUID.randomUUID().toString())
                .version(2L)
                .eventType(TankEventTypeEnum.TANK_NAME_CHANGED.getEventName())
                .payload("{not json")
                .build();
        TankEventPO empty = TankEventPO.builder()
                .aggregateId(UUID.randomUUID().toString())
                .version(2L)
                .eventType(TankEventTypeEnum.TANK_ACTIVATED.getEventName())
                .payload("")
                .build();

        Assertions.assertThrows(ReconstructionException.class, () -> serializer.toStoredEvent(corrupt));
        Assertions.assertThrows(ReconstructionException.class, () -> serializer.toStoredEvent(empty));
    }

    @Test
    public void shouldIgnoreFieldsAddedByNewerWriters() {
        TankAggregate tank = TankFixtures.newTank("Tank A");
        TankEventPO po = serializer.toPO(tank.getPendingEvents().get(0), 1);
        po.setPayload(po.getPayload().replaceFirst("\\{", "{\"colour\":\"blue\","));

        Assertions.assertEquals(tank.getPendingEvents().get(0), serializer.toStoredEvent(po).event());
    }

    @Test
    public void shouldRoundTripSnapshot() {
        TankAggregate tank = TankAggregate.replay(fullHistory());

        TankSnapshot snapshot = tank.toSnapshot();
        TankSnapshot restored = serializer.readSnapshot(serializer.writeSnapshot(snapshot));

        Assertions.assertEquals(snapshot, restored);
        Assertions.assertEquals(tank.toSnapshot(), TankAggregate.fromSnapshot(restored).toSnapshot());
    }

    private List<TankEvent> fullHistory() {
        TankAggregate tank = TankFixtures.newTank("Tank A");
        SensorEntity temperature = TankFixtures.temperatureSensor();
        SensorEntity ph = TankFixtures.sensor(SensorTypeEnum.PH);
        tank.rename("Tank B");
        tank.changeCapacity(TankCapacity.of(new BigDecimal("250.5"), CapacityUnitEnum.GAL));
        tank.relocate(new Location("Hatchery", "R2", "North", new BigDecimal("31.2304"), new BigDecimal("121.4737")));
        tank.setOptimalParameters(WaterQualityParameters.builder()
                .optimalTemperature(new BigDecimal("25.5"))
                .minPh(new BigDecimal("6.50"))
                .maxPh(new BigDecimal("8.00"))
                .build());
        tank.addSensor(temperature);
        tank.addSensor(ph);
        tank.activate();
        tank.calibrateSensor(ph.getSensorId(), LocalDateTime.now().minusHours(1), new BigDecimal("99.5"), "lab");
        tank.updateSensorRange(ph.getSensorId(), new BigDecimal("5.5"), new BigDecimal("9.5"));
        tank.changeSensorStatus(ph.getSensorId(), SensorStatusEnum.MAINTENANCE);
        tank.deactivateSensor(ph.getSensorId(), "probe swap");
        tank.activateSensor(ph.getSensorId());
        tank.removeSensor(temperature.getSensorId());
        tank.scheduleMaintenance(LocalDateTime.now().plusDays(2));
        tank.completeMaintenance(LocalDateTime.now().minusMinutes(5), "done");
        tank.deactivate("season end");
        return new ArrayList<>(tank.getPendingEvents());
    }

    private long distinctNames(List<TankEvent> events) {
        return events.stream().map(TankEvent::eventName).distinct().count();
    }
}
