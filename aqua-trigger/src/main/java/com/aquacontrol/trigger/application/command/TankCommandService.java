package com.aquacontrol.trigger.application.command;

import com.aquacontrol.domain.tank.adapter.repository.ITankRepository;
import com.aquacontrol.domain.tank.model.aggregate.TankAggregate;
import com.aquacontrol.domain.tank.model.entity.SensorEntity;
import com.aquacontrol.domain.tank.model.event.TankEvent;
import com.aquacontrol.domain.tank.model.valobj.Location;
import com.aquacontrol.domain.tank.model.valobj.SensorId;
import com.aquacontrol.domain.tank.model.valobj.TankCapacity;
import com.aquacontrol.domain.tank.model.valobj.TankId;
import com.aquacontrol.domain.tank.model.valobj.WaterQualityParameters;
import com.aquacontrol.domain.tank.service.TankUnitOfWorkDomainService;
import com.aquacontrol.domain.tank.service.TankUnitOfWorkDomainService.CommitResult;
import com.aquacontrol.domain.tank.service.TankUnitOfWorkDomainService.CommitWarning;
import com.aquacontrol.types.enums.ResponseCode;
import com.aquacontrol.types.enums.SensorStatusEnum;
import com.aquacontrol.types.enums.SensorTypeEnum;
import com.aquacontrol.types.enums.TankTypeEnum;
import com.aquacontrol.types.exception.AppException;
import com.aquacontrol.types.exception.ConcurrencyException;
import com.aquacontrol.types.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.function.Function;

/**
 * 鱼池写用例：加载 → 执行命令 → 工作单元提交。
 * <p>
 * 提交遇到并发冲突时重新加载并重跑整条命令，最多 {@code aqua.command.max-attempts} 次；
 * 参数校验失败与业务不变量冲突不重试。
 * </p>
 */
@Slf4j
@Service
public class TankCommandService {

    private final ITankRepository tankRepository;
    private final TankUnitOfWorkDomainService tankUnitOfWorkDomainService;
    private final int maxAttempts;

    public TankCommandService(ITankRepository tankRepository,
                              TankUnitOfWorkDomainService tankUnitOfWorkDomainService,
                              @Value("${aqua.command.max-attempts:3}") int maxAttempts) {
        this.tankRepository = tankRepository;
        this.tankUnitOfWorkDomainService = tankUnitOfWorkDomainService;
        this.maxAttempts = Math.max(maxAttempts, 1);
    }

    public TankCommandResult createTank(String name, TankCapacity capacity, Location location, TankTypeEnum tankType) {
        TankAggregate tank = TankAggregate.create(name, capacity, location, tankType);
        List<TankEvent> events = tank.getPendingEvents();
        CommitResult commitResult = tankUnitOfWorkDomainService.commit(tank);
        log.info("Tank created. tankId={}, name={}, type={}", tank.getTankId(), tank.getName(), tankType);
        return TankCommandResult.of(tank, events, commitResult.warnings(), 1);
    }

    public TankAggregate getTank(TankId tankId) {
        return loadRequired(tankId);
    }

    public TankCommandResult renameTank(TankId tankId, String newName) {
        return execute(tankId, tank -> tank.rename(newName));
    }

    public TankCommandResult changeCapacity(TankId tankId, TankCapacity capacity) {
        return execute(tankId, tank -> tank.changeCapacity(capacity));
    }

    public TankCommandResult relocate(TankId tankId, Location location) {
        return execute(tankId, tank -> tank.relocate(location));
    }

    public TankCommandResult activate(TankId tankId) {
        return execute(tankId, TankAggregate::activate);
    }

    public TankCommandResult deactivate(TankId tankId, String reason) {
        return execute(tankId, tank -> tank.deactivate(reason));
    }

    public TankCommandResult setOptimalParameters(TankId tankId, WaterQualityParameters parameters) {
        return execute(tankId, tank -> tank.setOptimalParameters(parameters));
    }

    public TankCommandResult scheduleMaintenance(TankId tankId, LocalDateTime scheduledDate) {
        return execute(tankId, tank -> tank.scheduleMaintenance(scheduledDate));
    }

    public TankCommandResult completeMaintenance(TankId tankId, LocalDateTime completionDate, String notes) {
        return execute(tankId, tank -> tank.completeMaintenance(completionDate, notes));
    }

    /**
     * 新建传感器并挂到鱼池上，重试时复用同一个传感器 ID。
     */
    public TankCommandResult addSensor(TankId tankId, SensorTypeEnum sensorType, String model,
                                       String manufacturer, String serialNumber, BigDecimal accuracy) {
        SensorEntity sensor = SensorEntity.create(sensorType, model, manufacturer, serialNumber, accuracy);
        return execute(tankId, tank -> tank.addSensor(sensor));
    }

    public TankCommandResult removeSensor(TankId tankId, SensorId sensorId) {
        return execute(tankId, tank -> tank.removeSensor(sensorId));
    }

    public TankCommandResult calibrateSensor(TankId tankId, SensorId sensorId, LocalDateTime calibrationDate,
                                             BigDecimal accuracy, String notes) {
        return execute(tankId, tank -> tank.calibrateSensor(sensorId, calibrationDate, accuracy, notes));
    }

    public TankCommandResult updateSensorRange(TankId tankId, SensorId sensorId, BigDecimal minValue, BigDecimal maxValue) {
        return execute(tankId, tank -> tank.updateSensorRange(sensorId, minValue, maxValue));
    }

    public TankCommandResult activateSensor(TankId tankId, SensorId sensorId) {
        return execute(tankId, tank -> tank.activateSensor(sensorId));
    }

    public TankCommandResult deactivateSensor(TankId tankId, SensorId sensorId, String reason) {
        return execute(tankId, tank -> tank.deactivateSensor(sensorId, reason));
    }

    public TankCommandResult changeSensorStatus(TankId tankId, SensorId sensorId, SensorStatusEnum status) {
        return execute(tankId, tank -> tank.changeSensorStatus(sensorId, status));
    }

    private TankCommandResult execute(TankId tankId, Function<TankAggregate, List<TankEvent>> command) {
        for (int attempt = 1; ; attempt++) {
            TankAggregate tank = loadRequired(tankId);
            List<TankEvent> events = command.apply(tank);
            if (events.isEmpty()) {
                return TankCommandResult.of(tank, events, List.of(), attempt);
            }
            try {
                CommitResult commitResult = tankUnitOfWorkDomainService.commit(tank);
                return TankCommandResult.of(tank, events, commitResult.warnings(), attempt);
            } catch (ConcurrencyException ex) {
                if (attempt >= maxAttempts) {
                    log.warn("Tank command retry exhausted. tankId={}, attempts={}", tankId, attempt);
                    throw ex;
                }
                log.warn("Tank command conflict, reloading. tankId={}, attempt={}, expectedVersion={}",
                        tankId, attempt, ex.getExpectedVersion());
            }
        }
    }

    private TankAggregate loadRequired(TankId tankId) {
        if (tankId == null) {
            throw new ValidationException("Tank id cannot be null");
        }
        return tankRepository.load(tankId)
                .orElseThrow(() -> new AppException(ResponseCode.NOT_FOUND.getCode(), "Tank not found: " + tankId));
    }

    /**
     * 命令执行结果：提交后的版本、本次产生的事件与非致命告警。
     */
    public record TankCommandResult(TankId tankId,
                                    long version,
                                    List<TankEvent> events,
                                    List<CommitWarning> warnings,
                                    int attempts) {

        static TankCommandResult of(TankAggregate tank, List<TankEvent> events, List<CommitWarning> warnings,
                                    int attempts) {
            return new TankCommandResult(tank.getTankId(), tank.getVersion(), List.copyOf(events),
                    List.copyOf(warnings), attempts);
        }

        public boolean changed() {
            return !events.isEmpty();
        }
    }
}
