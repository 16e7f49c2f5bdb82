package com.ryuqq.olympus.application.validation;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ValidatorConfigTest {

    @Test
    void 기본값은_freeze와_로그_모두_켜짐() {
        ValidatorConfig config = new ValidatorConfig();

        assertTrue(config.freezeRegistry());
        assertTrue(config.logFailures());
    }

    @Test
    void with_메서드는_해당_값만_바꿈() {
        ValidatorConfig config = new ValidatorConfig().withFreezeRegistry(false);

        assertEquals(new ValidatorConfig(false, true), config);
        assertEquals(new ValidatorConfig(false, false), config.withLogFailures(false));
    }
}
