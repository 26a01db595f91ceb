package com.wshg.productsearch.catalog;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.util.Objects;
import java.util.UUID;

/**
 * 数据访问范围。向量流水线与平台检索跨租户读取，必须显式传入 {@link #platform()}；
 * 租户内读取传入 {@link #tenant(UUID)}。不依赖任何全局租户过滤开关。
 */
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class DataScope {

    private static final DataScope PLATFORM = new DataScope(null);

    private final UUID tenantId;

    public static DataScope platform() {
        return PLATFORM;
    }

    public static DataScope tenant(UUID tenantId) {
        return new DataScope(Objects.requireNonNull(tenantId, "tenantId"));
    }

    public boolean isPlatform() {
        return tenantId == null;
    }

    /** 平台范围时为 null */
    public UUID getTenantId() {
        return tenantId;
    }
}
