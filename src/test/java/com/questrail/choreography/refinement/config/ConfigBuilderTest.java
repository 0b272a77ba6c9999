package com.questrail.choreography.refinement.config;

import com.questrail.choreography.refinement.naming.MappingNameConvention;
import com.questrail.choreography.refinement.naming.PrefixNameConvention;
import com.questrail.choreography.refinement.observability.NullObservabilitySink;
import com.questrail.choreography.refinement.observability.Slf4jRefinementObservabilitySink;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigBuilderTest
{
    @Test
    void refinementDefaults() {
        RefinementConfig config = RefinementConfig.defaults();

        assertSame(PrefixNameConvention.defaults(), config.nameConvention());
        assertInstanceOf(Slf4jRefinementObservabilitySink.class, config.observabilitySink());
        assertFalse(config.recordTrace());
    }

    @Test
    void refinementOverrides() {
        MappingNameConvention naming = MappingNameConvention.builder().build();

        RefinementConfig config = RefinementConfig.builder()
                .withNameConvention(naming)
                .withObservabilitySink(NullObservabilitySink.INSTANCE)
                .withRecordTrace(true)
                .build();

        assertSame(naming, config.nameConvention());
        assertSame(NullObservabilitySink.INSTANCE, config.observabilitySink());
        assertTrue(config.recordTrace());
    }

    @Test
    void refinementRequiresCollaborators() {
        assertThrows(NullPointerException.class,
                () -> RefinementConfig.builder().withNameConvention(null).build());
        assertThrows(NullPointerException.class,
                () -> RefinementConfig.builder().withObservabilitySink(null).build());
    }

    @Test
    void solverDefaults() {
        SolverConfig config = SolverConfig.defaults();

        assertEquals(List.of("z3", "-smt2"), config.command());
        assertEquals(Duration.ofSeconds(10), config.timeout());
        assertEquals("QF_LRA", config.logic());
    }

    @Test
    void solverCommandIsCopied() {
        List<String> command = new ArrayList<>(List.of("cvc5", "--lang=smt2"));
        SolverConfig config = SolverConfig.builder().withCommand(command).withLogic("QF_LIA").build();

        command.add("--incremental");

        assertEquals(List.of("cvc5", "--lang=smt2"), config.command());
        assertEquals("QF_LIA", config.logic());
    }

    @Test
    void solverRejectsInvalidSettings() {
        assertThrows(IllegalArgumentException.class,
                () -> SolverConfig.builder().withCommand(List.of()).build());
        assertThrows(IllegalArgumentException.class,
                () -> SolverConfig.builder().withTimeout(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class,
                () -> SolverConfig.builder().withTimeout(Duration.ofSeconds(-1)).build());
    }
}
