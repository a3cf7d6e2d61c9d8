package com.aquacontrol.config;

import com.aquacontrol.domain.tank.adapter.repository.ITankEventStore;
import com.aquacontrol.domain.tank.adapter.repository.ITankRepository;
import com.aquacontrol.infrastructure.repository.tank.TankRepositoryImpl;
import com.aquacontrol.types.common.Constants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 事件溯源仓储装配。
 *
 * @author aquacontrol
 * @since 2025-03-02
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(EventSourcingConfigProperties.class)
public class EventSourcingConfig {

    @Bean
    public ITankRepository tankRepository(ITankEventStore tankEventStore, EventSourcingConfigProperties properties) {
        Integer configured = properties.getSnapshotThreshold();
        int threshold = configured == null || configured <= 0 ? Constants.DEFAULT_SNAPSHOT_THRESHOLD : configured;
        log.info("Tank repository initialized. snapshotThreshold={}", threshold);
        return new TankRepositoryImpl(tankEventStore, threshold);
    }
}
