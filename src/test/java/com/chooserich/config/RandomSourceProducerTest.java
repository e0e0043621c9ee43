package com.chooserich.config;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.chooserich.client.RandomOracleClient;
import com.chooserich.service.ApexEngine;
import com.chooserich.service.AuditedRandom;
import com.chooserich.service.LocalRandomSource;
import com.chooserich.service.MinesEngine;
import com.chooserich.service.OracleRandomSource;
import com.chooserich.service.RandomSource;
import java.lang.reflect.Constructor;
import java.lang.reflect.Parameter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RandomSourceProducerTest {

    private RandomSourceProducer producer;

    @BeforeEach
    void setUp() {
        producer = new RandomSourceProducer();
        producer.oracleClient = mock(RandomOracleClient.class);
        producer.oracleEnabled = true;
    }

    @Test
    void plainSourceNeverCallsTheOracle() {
        RandomSource local = producer.localRandomSource();

        assertInstanceOf(LocalRandomSource.class, local);
        for (int i = 0; i < 100; i++) {
            local.nextInt(1, 400);
        }
        verify(producer.oracleClient, never()).fetch();
    }

    @Test
    void auditedSourceReportsToTheOracleWhenEnabled() {
        assertInstanceOf(OracleRandomSource.class, producer.auditedRandomSource());

        producer.oracleEnabled = false;
        assertInstanceOf(LocalRandomSource.class, producer.auditedRandomSource());
    }

    @Test
    void onlyApexDrawsAreAudited() throws Exception {
        assertTrue(randomSourceIsAudited(ApexEngine.class));
        assertFalse(randomSourceIsAudited(MinesEngine.class));
    }

    private static boolean randomSourceIsAudited(Class<?> engine) throws NoSuchMethodException {
        Constructor<?> constructor = engine.getConstructor(RandomSource.class, double.class);
        Parameter randomSource = constructor.getParameters()[0];
        return randomSource.isAnnotationPresent(AuditedRandom.class);
    }
}
