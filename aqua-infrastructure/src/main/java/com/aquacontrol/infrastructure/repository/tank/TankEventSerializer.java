package com.aquacontrol.infrastructure.repository.tank;

import com.aquacontrol.domain.tank.model.event.TankEvent;
import com.aquacontrol.domain.tank.model.event.TankEvent.UnknownTankEvent;
import com.aquacontrol.domain.tank.model.valobj.StoredTankEvent;
import com.aquacontrol.domain.tank.model.valobj.TankId;
import com.aquacontrol.domain.tank.model.valobj.TankSnapshot;
import com.aquacontrol.infrastructure.dao.po.TankEventPO;
import com.aquacontrol.infrastructure.util.JsonCodec;
import com.aquacontrol.types.common.Constants;
import com.aquacontrol.types.enums.TankEventTypeEnum;
import com.aquacontrol.types.exception.AppException;
import com.aquacontrol.types.exception.ReconstructionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;

/**
 * 鱼池事件与事件表行之间的转换。
 * <p>
 * 每行由类型标签 event_type 与 JSON 载荷组成。未知标签转成 {@link UnknownTankEvent}，
 * 已知标签但载荷无法解析视为事件日志损坏，抛出 {@link ReconstructionException}。
 * </p>
 */
@Slf4j
@Component
public class TankEventSerializer {

    private static final Map<TankEventTypeEnum, Class<? extends TankEvent>> EVENT_CLASSES;

    static {
        Map<TankEventTypeEnum, Class<? extends TankEvent>> classes = new EnumMap<>(TankEventTypeEnum.class);
        classes.put(TankEventTypeEnum.TANK_CREATED, TankEvent.TankCreated.class);
        classes.put(TankEventTypeEnum.TANK_NAME_CHANGED, TankEvent.TankNameChanged.class);
        classes.put(TankEventTypeEnum.TANK_CAPACITY_CHANGED, TankEvent.TankCapacityChanged.class);
        classes.put(TankEventTypeEnum.TANK_RELOCATED, TankEvent.TankRelocated.class);
        classes.put(TankEventTypeEnum.TANK_ACTIVATED, TankEvent.TankActivated.class);
        classes.put(TankEventTypeEnum.TANK_DEACTIVATED, TankEvent.TankDeactivated.class);
        classes.put(TankEventTypeEnum.TANK_OPTIMAL_PARAMETERS_SET, TankEvent.TankOptimalParametersSet.class);
        classes.put(TankEventTypeEnum.TANK_MAINTENANCE_SCHEDULED, TankEvent.TankMaintenanceScheduled.class);
        classes.put(TankEventTypeEnum.TANK_MAINTENANCE_COMPLETED, TankEvent.TankMaintenanceCompleted.class);
        classes.put(TankEventTypeEnum.SENSOR_ADDED_TO_TANK, TankEvent.SensorAddedToTank.class);
        classes.put(TankEventTypeEnum.SENSOR_REMOVED_FROM_TANK, TankEvent.SensorRemovedFromTank.class);
        classes.put(TankEventTypeEnum.SENSOR_CALIBRATED, TankEvent.SensorCalibrated.class);
        classes.put(TankEventTypeEnum.SENSOR_RANGE_UPDATED, TankEvent.SensorRangeUpdated.class);
        classes.put(TankEventTypeEnum.SENSOR_ACTIVATED, TankEvent.SensorActivated.class);
        classes.put(TankEventTypeEnum.SENSOR_DEACTIVATED, TankEvent.SensorDeactivated.class);
        classes.put(TankEventTypeEnum.SENSOR_STATUS_CHANGED, TankEvent.SensorStatusChanged.class);
        EVENT_CLASSES = Collections.unmodifiableMap(classes);
    }

    private final JsonCodec jsonCodec;

    public TankEventSerializer(JsonCodec jsonCodec) {
        this.jsonCodec = jsonCodec;
    }

    public static Class<? extends TankEvent> eventClassOf(TankEventTypeEnum type) {
        return EVENT_CLASSES.get(type);
    }

    public TankEventPO toPO(TankEvent event, long version) {
        String payload = event instanceof UnknownTankEvent unknown
                ? unknown.payload()
                : jsonCodec.writeValue(event);
        return TankEventPO.builder()
                .eventId(event.eventId().toString())
                .aggregateId(event.tankId().toString())
                .aggregateType(Constants.TANK_AGGREGATE_TYPE)
                .version(version)
                .eventType(event.eventName())
                .payload(payload)
                .occurredAt(event.occurredAt())
                .build();
    }

    public StoredTankEvent toStoredEvent(TankEventPO po) {
        TankEventTypeEnum type = TankEventTypeEnum.fromEventName(po.getEventType());
        if (type == null) {
            log.warn("Unrecognized tank event type tag. aggregateId={}, version={}, eventType={}",
                    po.getAggregateId(), po.getVersion(), po.getEventType());
            UnknownTankEvent unknown = new UnknownTankEvent(parseEventId(po), TankId.of(po.getAggregateId()),
                    po.getOccurredAt(), po.getEventType(), po.getPayload());
            return new StoredTankEvent(po.getVersion(), unknown);
        }
        TankEvent event;
        try {
            event = jsonCodec.readValue(po.getPayload(), EVENT_CLASSES.get(type));
        } catch (AppException ex) {
            throw new ReconstructionException("Failed to deserialize " + po.getEventType()
                    + " event at version " + po.getVersion() + " of tank " + po.getAggregateId(), ex);
        }
        if (event == null) {
            throw new ReconstructionException("Empty payload for " + po.getEventType()
                    + " event at version " + po.getVersion() + " of tank " + po.getAggregateId());
        }
        return new StoredTankEvent(po.getVersion(), event);
    }

    public String writeSnapshot(TankSnapshot snapshot) {
        return jsonCodec.writeValue(snapshot);
    }

    public TankSnapshot readSnapshot(String payload) {
        return jsonCodec.readValue(payload, TankSnapshot.class);
    }

    private UUID parseEventId(TankEventPO po) {
        try {
            return po.getEventId() == null ? null : UUID.fromString(po.getEventId());
        } catch (IllegalArgumentException ex) {
            log.warn("Invalid event id on tank event row. aggregateId={}, version={}, eventId={}",
                    po.getAggregateId(), po.getVersion(), po.getEventId());
            return null;
        }
    }
}
