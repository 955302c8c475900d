package me.golemcore.nexus.domain.budget;

import me.golemcore.nexus.infrastructure.config.NexusProperties;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TokenBudgetFactoryTest {

    @Test
    void shouldCreateFreshBudgetPerCall() {
        TokenBudgetFactory factory = new TokenBudgetFactory(new NexusProperties());

        TokenBudget first = factory.create();
        TokenBudget second = factory.create();
        first.allocate("system", 500);

        assertNotSame(first, second);
        assertEquals(100_800, second.getCapacityCeiling());
        assertEquals(0, second.getUsed());
    }

    @Test
    void shouldApplyConfiguredParameters() {
        NexusProperties properties = new NexusProperties();
        properties.getBudget().setTotalContext(32_000);
        properties.getBudget().setReservedOutput(4_000);
        properties.getBudget().setSafetyBufferFraction(0.5);

        TokenBudget budget = new TokenBudgetFactory(properties).create();

        assertEquals(12_000, budget.getCapacityCeiling());
    }

    @Test
    void shouldFailFastOnUnusableContextWindow() {
        NexusProperties properties = new NexusProperties();
        properties.getBudget().setTotalContext(8_000);
        properties.getBudget().setReservedOutput(8_000);

        assertThrows(InsufficientContextException.class, () -> new TokenBudgetFactory(properties));
    }
}
