package com.custodyledger.transfer;

import com.custodyledger.common.Amount;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryTransferGatewayTest {

    private InMemoryTransferGateway gateway;

    @BeforeEach
    void setUp() {
        gateway = new InMemoryTransferGateway();
    }

    @Test
    void testTransferAccumulatesPerPrincipal() {
        assertTrue(gateway.transfer("alice", Amount.of(30)));
        assertTrue(gateway.transfer("alice", Amount.of(20)));
        assertTrue(gateway.transfer("bob", Amount.of(5)));

        assertEquals(Amount.of(50), gateway.deliveredTo("alice"));
        assertEquals(Amount.of(5), gateway.deliveredTo("bob"));
        assertEquals(Amount.ZERO, gateway.deliveredTo("carol"));
        assertEquals(3, gateway.getPayouts().size());
        assertEquals("alice", gateway.getPayouts().get(0).getTo());
    }

    @Test
    void testUnhealthyGatewayRefuses() {
        gateway.setHealthy(false);

        assertFalse(gateway.isHealthy());
        assertFalse(gateway.transfer("alice", Amount.of(30)));
        assertEquals(Amount.ZERO, gateway.deliveredTo("alice"));
        assertTrue(gateway.getPayouts().isEmpty());
    }

    @Test
    void testCallbackRunsBeforeSettlement() {
        List<Amount> seenDelivered = new ArrayList<>();
        gateway.setDuringTransfer((to, amount) -> seenDelivered.add(gateway.deliveredTo(to)));

        gateway.transfer("alice", Amount.of(30));

        assertEquals(List.of(Amount.ZERO), seenDelivered);
        assertEquals(Amount.of(30), gateway.deliveredTo("alice"));
    }

    @Test
    void testReset() {
        gateway.transfer("alice", Amount.of(30));
        gateway.setHealthy(false);
        gateway.setDuringTransfer((to, amount) -> { });

        gateway.reset();

        assertTrue(gateway.isHealthy());
        assertEquals(Amount.ZERO, gateway.deliveredTo("alice"));
        assertTrue(gateway.getPayouts().isEmpty());
        assertEquals("InMemory", gateway.getGatewayName());
    }
}
