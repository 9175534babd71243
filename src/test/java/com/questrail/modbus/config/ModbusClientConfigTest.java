package com.questrail.modbus.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

final class ModbusClientConfigTest
{
    @Test
    void defaults()
    {
        ModbusClientConfig config = ModbusClientConfig.builder().withHost("10.0.0.5").build();

        assertEquals(502, config.port());
        assertEquals(Duration.ofMillis(1000), config.connectTimeout());
        assertEquals(Duration.ofMillis(1000), config.readTimeout());
    }

    @Test
    void timeoutsCanBeSetSeparately()
    {
        ModbusClientConfig config = ModbusClientConfig.builder()
                .withHost("plc")
                .withTimeout(Duration.ofSeconds(3))
                .withReadTimeout(Duration.ofMillis(200))
                .build();

        assertEquals(Duration.ofSeconds(3), config.connectTimeout());
        assertEquals(Duration.ofMillis(200), config.readTimeout());
    }

    @Test
    void rejectsInvalidValues()
    {
        assertThrows(NullPointerException.class, () -> ModbusClientConfig.builder().build());
        assertThrows(IllegalArgumentException.class, () -> ModbusClientConfig.builder().withHost(" ").build());
        assertThrows(IllegalArgumentException.class,
                () -> ModbusClientConfig.builder().withHost("plc").withPort(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> ModbusClientConfig.builder().withHost("plc").withPort(65536).build());
        assertThrows(IllegalArgumentException.class,
                () -> ModbusClientConfig.builder().withHost("plc").withTimeout(Duration.ZERO).build());
    }

    @Test
    void timeoutsMustFitIntMilliseconds()
    {
        ModbusClientConfig config = ModbusClientConfig.builder()
                .withHost("plc")
                .withTimeout(ModbusClientConfig.MAX_TIMEOUT)
                .build();
        assertEquals(Integer.MAX_VALUE, config.connectTimeout().toMillis());

        Duration tooLong = ModbusClientConfig.MAX_TIMEOUT.plusMillis(1);
        assertThrows(IllegalArgumentException.class,
                () -> ModbusClientConfig.builder().withHost("plc").withConnectTimeout(tooLong).build());
        assertThrows(IllegalArgumentException.class,
                () -> ModbusClientConfig.builder().withHost("plc").withReadTimeout(Duration.ofDays(30)).build());
    }
}
