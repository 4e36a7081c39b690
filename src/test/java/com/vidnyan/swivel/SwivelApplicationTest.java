package com.vidnyan.swivel;

import com.vidnyan.swivel.application.port.in.HealSourceUseCase;
import com.vidnyan.swivel.application.port.in.ValidateSourceUseCase;
import com.vidnyan.swivel.config.SwivelProperties;
import com.vidnyan.swivel.domain.model.ValidationDepth;
import com.vidnyan.swivel.domain.model.ValidationResult;
import com.vidnyan.swivel.domain.model.ValidationStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
        "swivel.validate.path=",
        "swivel.sandbox.timeout=15s",
        "swivel.healing.max-iterations=3"
})
class SwivelApplicationTest {

    @Autowired
    private ValidateSourceUseCase validateSourceUseCase;

    @Autowired
    private HealSourceUseCase healSourceUseCase;

    @Autowired
    private SwivelProperties properties;

    @Test
    void contextLoads_ShouldBindProperties() {
        assertEquals(Duration.ofSeconds(15), properties.getSandbox().getTimeout());
        assertEquals(3, properties.getHealing().getMaxIterations());
        assertEquals(ValidationDepth.FULL, properties.getValidate().getDepth());
    }

    @Test
    void validate_ShouldRunWiredPipeline() {
        ValidationResult result = validateSourceUseCase.validate(SamplePrograms.GREETER_WITH_FILES_IMPORT,
                ValidationDepth.FAST);

        assertEquals(ValidationStatus.FAIL, result.status());
        assertTrue(result.hasCode("E201"));
    }

    @Test
    void heal_ShouldUseConfiguredCeiling() {
        assertEquals(3, healSourceUseCase.heal(SamplePrograms.GREETER).maxIterations());
    }
}
