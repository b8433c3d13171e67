package com.jobJumper.careerAi.normalization.validator;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.Collection;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Walks a validated record and fails on the first null field.
 */
final class RecordAssertions {

    private static final String MODEL_PACKAGE = "com.jobJumper.careerAi.normalization.model";

    private RecordAssertions() {}

    static void assertFullyPopulated(Object record) {
        assertFullyPopulated(record, record.getClass().getSimpleName());
    }

    private static void assertFullyPopulated(Object value, String path) {
        assertThat(value).as(path).isNotNull();
        if (value instanceof Collection<?> collection) {
            int i = 0;
            for (Object element : collection) {
                assertFullyPopulated(element, path + "[" + i++ + "]");
            }
            return;
        }
        Class<?> type = value.getClass();
        if (type.isEnum() || !type.getPackageName().equals(MODEL_PACKAGE)) {
            return;
        }
        for (Field field : type.getDeclaredFields()) {
            if (Modifier.isStatic(field.getModifiers())) {
                continue;
            }
            field.setAccessible(true);
            try {
                assertFullyPopulated(field.get(value), path + "." + field.getName());
            } catch (IllegalAccessException e) {
                throw new AssertionError("Cannot read " + path + "." + field.getName(), e);
            }
        }
    }
}
