/**
 * Tank 领域 - 鱼池与传感器（事件溯源）
 *
 * <p>职责：鱼池生命周期、传感器管理、维护与校准计划</p>
 *
 * <h3>聚合根</h3>
 * <ul>
 *   <li>{@link com.aquacontrol.domain.tank.model.aggregate.TankAggregate}</li>
 * </ul>
 *
 * <h3>核心概念</h3>
 * <ul>
 *   <li>领域事件：每次状态迁移对应一条不可变事件，事件日志是唯一事实来源</li>
 *   <li>回放：由快照与后续事件重建聚合，回放不校验业务规则</li>
 *   <li>乐观并发：追加事件时校验期望版本</li>
 * </ul>
 *
 * <h3>领域服务</h3>
 * <ul>
 *   <li>TankUnitOfWorkDomainService - 提交待持久化事件、更新读模型、发布事件</li>
 * </ul>
 *
 * @author aquacontrol
 * @since 2025-03-02
 */
package com.aquacontrol.domain.tank;
