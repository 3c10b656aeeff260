package com.carelink.backend.support;

import java.lang.reflect.Field;
import java.util.UUID;

/**
 * Entity ids are generated by Hibernate, so unit tests assign them directly.
 */
public final class TestEntities {

    private TestEntities() {
    }

    public static <T> T withId(T entity, UUID id) {
        Class<?> type = entity.getClass();
        while (type != null) {
            try {
                Field idField = type.getDeclaredField("id");
                idField.setAccessible(true);
                idField.set(entity, id);
                return entity;
            } catch (NoSuchFieldException ex) {
                type = type.getSuperclass();
            } catch (ReflectiveOperationException ex) {
                throw new IllegalStateException(ex);
            }
        }
        throw new IllegalStateException("No id field on " + entity.getClass());
    }
}
