package com.aquacontrol.domain.tank.service;

import com.aquacontrol.domain.tank.adapter.gateway.ITankEventPublisher;
import com.aquacontrol.domain.tank.adapter.repository.ITankReadModelRepository;
import com.aquacontrol.domain.tank.adapter.repository.ITankRepository;
import com.aquacontrol.domain.tank.model.aggregate.TankAggregate;
import com.aquacontrol.domain.tank.model.entity.TankReadModelEntity;
import com.aquacontrol.domain.tank.model.event.TankEvent;
import com.aquacontrol.types.exception.ConcurrencyException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * 鱼池工作单元领域服务：以事件日志为准的提交流程。
 * <p>
 * 1) 逐个聚合追加待提交事件（唯一的“记录事务”）；
 * 2) 尽力更新读模型，失败只记告警；
 * 3) 逐条发布已持久化的事件，单条失败不影响其它事件；
 * 4) 发布后清空聚合的待提交事件。
 * 第 k 个聚合追加失败时，已追加的聚合仍走完 2)~4)，随后把异常原样抛出。
 * </p>
 */
@Slf4j
@Service
public class TankUnitOfWorkDomainService {

    private final ITankRepository tankRepository;
    private final ITankReadModelRepository tankReadModelRepository;
    private final ITankEventPublisher tankEventPublisher;

    private final Counter commitCounter;
    private final Counter conflictCounter;
    private final Counter secondaryWriteFailureCounter;
    private final Counter publishFailureCounter;

    public TankUnitOfWorkDomainService(ITankRepository tankRepository,
                                       ITankReadModelRepository tankReadModelRepository,
                                       ITankEventPublisher tankEventPublisher) {
        this.tankRepository = tankRepository;
        this.tankReadModelRepository = tankReadModelRepository;
        this.tankEventPublisher = tankEventPublisher;
        this.commitCounter = Counter.builder("aqua.tank.commit.total").register(Metrics.globalRegistry);
        this.conflictCounter = Counter.builder("aqua.tank.commit.conflict.total").register(Metrics.globalRegistry);
        this.secondaryWriteFailureCounter = Counter.builder("aqua.tank.read_model.failure.total")
                .register(Metrics.globalRegistry);
        this.publishFailureCounter = Counter.builder("aqua.tank.publish.failure.total")
                .register(Metrics.globalRegistry);
    }

    public CommitResult commit(TankAggregate... aggregates) {
        return commit(aggregates == null ? Collections.emptyList() : Arrays.asList(aggregates));
    }

    public CommitResult commit(List<TankAggregate> aggregates) {
        List<TankAggregate> persisted = new ArrayList<>();
        RuntimeException failure = null;
        for (TankAggregate tank : aggregates) {
            if (tank == null || !tank.hasPendingEvents()) {
                continue;
            }
            try {
                tankRepository.persist(tank);
                persisted.add(tank);
            } catch (ConcurrencyException ex) {
                conflictCounter.increment();
                log.warn("Tank commit conflict. tankId={}, expectedVersion={}, actualVersion={}",
                        ex.getAggregateId(), ex.getExpectedVersion(), ex.getActualVersion());
                failure = ex;
                break;
            } catch (RuntimeException ex) {
                log.error("Tank commit failed while appending events. tankId={}, error={}",
                        tank.getTankId(), ex.getMessage(), ex);
                failure = ex;
                break;
            }
        }

        List<CommitWarning> warnings = new ArrayList<>();
        int committedEventCount = 0;
        for (TankAggregate tank : persisted) {
            List<TankEvent> events = tank.getPendingEvents();
            upsertReadModel(tank, warnings);
            for (TankEvent event : events) {
                publish(event, warnings);
            }
            tank.markEventsCommitted();
            committedEventCount += events.size();
        }

        if (failure != null) {
            throw failure;
        }
        if (committedEventCount > 0) {
            commitCounter.increment();
            log.info("Tank commit finished. aggregates={}, events={}, warnings={}",
                    persisted.size(), committedEventCount, warnings.size());
        }
        return new CommitResult(committedEventCount, warnings);
    }

    private void upsertReadModel(TankAggregate tank, List<CommitWarning> warnings) {
        try {
            tankReadModelRepository.upsert(TankReadModelEntity.from(tank));
        } catch (RuntimeException ex) {
            secondaryWriteFailureCounter.increment();
            log.warn("Tank read model upsert failed. tankId={}, version={}, error={}",
                    tank.getTankId(), tank.getVersion(), ex.getMessage());
            warnings.add(new CommitWarning(CommitWarningType.SECONDARY_WRITE,
                    String.valueOf(tank.getTankId()), null, ex.getMessage()));
        }
    }

    private void publish(TankEvent event, List<CommitWarning> warnings) {
        try {
            tankEventPublisher.publish(event);
        } catch (RuntimeException ex) {
            publishFailureCounter.increment();
            log.warn("Tank event publish failed. tankId={}, eventId={}, eventType={}, error={}",
                    event.tankId(), event.eventId(), event.eventName(), ex.getMessage());
            warnings.add(new CommitWarning(CommitWarningType.PUBLISH,
                    String.valueOf(event.tankId()), event.eventId(), ex.getMessage()));
        }
    }

    public enum CommitWarningType {
        SECONDARY_WRITE,
        PUBLISH
    }

    /**
     * 提交中的非致命问题，事件已经持久化。
     */
    public record CommitWarning(CommitWarningType type, String tankId, UUID eventId, String message) {
    }

    public record CommitResult(int committedEventCount, List<CommitWarning> warnings) {

        public CommitResult {
            warnings = warnings == null ? List.of() : List.copyOf(warnings);
        }

        public boolean hasWarnings() {
            return !warnings.isEmpty();
        }
    }
}
