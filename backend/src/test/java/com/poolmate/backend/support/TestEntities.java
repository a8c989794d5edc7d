package com.poolmate.backend.support;

import java.lang.reflect.Field;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.poolmate.backend.modules.pool.domain.Pool;
import com.poolmate.backend.modules.pool.domain.PoolFrequency;
import com.poolmate.backend.modules.pool.domain.PoolMember;
import com.poolmate.backend.modules.pool.domain.PoolStatus;

public final class TestEntities {

    private TestEntities() {
    }

    public static void setField(Object target, String fieldName, Object value) {
        Class<?> type = target.getClass();
        while (type != null) {
            try {
                Field field = type.getDeclaredField(fieldName);
                field.setAccessible(true);
                field.set(target, value);
                return;
            } catch (NoSuchFieldException ex) {
                type = type.getSuperclass();
            } catch (IllegalAccessException ex) {
                throw new IllegalStateException(ex);
            }
        }
        throw new IllegalArgumentException("no field " + fieldName + " on " + target.getClass());
    }

    public static Object getField(Object target, String fieldName) {
        Class<?> type = target.getClass();
        while (type != null) {
            try {
                Field field = type.getDeclaredField(fieldName);
                field.setAccessible(true);
                return field.get(target);
            } catch (NoSuchFieldException ex) {
                type = type.getSuperclass();
            } catch (IllegalAccessException ex) {
                throw new IllegalStateException(ex);
            }
        }
        throw new IllegalArgumentException("no field " + fieldName + " on " + target.getClass());
    }

    public static void assignIdIfMissing(Object entity) {
        if (getField(entity, "id") == null) {
            setField(entity, "id", UUID.randomUUID());
        }
    }

    /**
     * Active monthly pool with {@code memberCount} members who joined one day apart.
     */
    public static Pool activePool(String name, long contribution, int memberCount, OffsetDateTime firstJoin) {
        Pool pool = new Pool();
        setField(pool, "id", UUID.randomUUID());
        pool.setName(name);
        pool.setContributionAmount(contribution);
        pool.setFrequency(PoolFrequency.MONTHLY);
        pool.setStatus(PoolStatus.ACTIVE);
        pool.setTreasurerUserId(UUID.randomUUID());
        pool.setActivatedAt(firstJoin);
        for (int i = 0; i < memberCount; i++) {
            pool.getMembers().add(member(pool, "member-" + (i + 1), firstJoin.plusDays(i)));
        }
        return pool;
    }

    public static PoolMember member(Pool pool, String displayName, OffsetDateTime joinedAt) {
        PoolMember member = new PoolMember();
        setField(member, "id", UUID.randomUUID());
        member.setPool(pool);
        member.setUserId(UUID.randomUUID());
        member.setDisplayName(displayName);
        member.setJoinedAt(joinedAt);
        return member;
    }
}
