package com.ciro.jprops.runtime;

import com.ciro.jprops.JpropsConfig;
import com.ciro.jprops.model.TextBlock;
import com.ciro.jprops.reflect.FieldCategory;
import com.ciro.jprops.reflect.FieldDescriptor;
import com.ciro.jprops.reflect.ReflectionTypeProvider;
import com.ciro.jprops.spi.TypeReflection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Type;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CachingTypeReflectionTest {

    /** Cuenta las llamadas que llegan a la reflexión real */
    static class CountingReflection implements TypeReflection {
        final ReflectionTypeProvider real = new ReflectionTypeProvider();
        final AtomicInteger fieldCalls = new AtomicInteger();
        final AtomicInteger describeCalls = new AtomicInteger();

        @Override
        public List<FieldDescriptor> fields(Class<?> type) {
            fieldCalls.incrementAndGet();
            return real.fields(type);
        }

        @Override
        public FieldDescriptor describe(String name, Type type) {
            describeCalls.incrementAndGet();
            return real.describe(name, type);
        }
    }

    private CountingReflection counting;
    private CachingTypeReflection cached;

    @BeforeEach
    void setUp() {
        counting = new CountingReflection();
        cached = new CachingTypeReflection(counting, new JpropsConfig());
    }

    @Test
    void fieldsAreComputedOncePerType() {
        List<FieldDescriptor> first = cached.fields(TextBlock.class);
        List<FieldDescriptor> second = cached.fields(TextBlock.class);

        assertSame(first, second);
        assertEquals(1, counting.fieldCalls.get());
        assertEquals(1, cached.stats().hitCount());
    }

    @Test
    void lookupsGoThroughTheCache() {
        assertTrue(cached.findField(TextBlock.class, "FontSize", true).isPresent());
        assertTrue(cached.findField(TextBlock.class, "fontSize", false).isPresent());
        assertFalse(cached.findField(TextBlock.class, "FontSize", false).isPresent());

        assertEquals(1, counting.fieldCalls.get());
    }

    @Test
    void describeIsCachedByNameAndType() {
        FieldDescriptor a = cached.describe("ZOrder", int.class);
        FieldDescriptor b = cached.describe("ZOrder", int.class);
        cached.describe("Other", int.class);

        assertSame(a, b);
        assertEquals(FieldCategory.INT, a.category());
        assertEquals(2, counting.describeCalls.get());
    }

    @Test
    void invalidateAllForcesReload() {
        cached.fields(TextBlock.class);
        cached.invalidateAll();
        cached.fields(TextBlock.class);

        assertEquals(2, counting.fieldCalls.get());
    }

    @Test
    void sameDescriptorsAsPlainReflection() {
        assertEquals(new ReflectionTypeProvider().fields(TextBlock.class),
                new CachingTypeReflection(new JpropsConfig()).fields(TextBlock.class));
    }
}
