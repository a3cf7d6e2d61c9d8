/**
 * 基础设施层：事件存储、快照、读模型的 MyBatis 持久化实现，以及 JSON 编解码。
 *
 * @author aquacontrol
 * @since 2025-03-02
 */
package com.aquacontrol.infrastructure;
