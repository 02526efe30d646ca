package dao.ore.bmine.service;

import dao.ore.bmine.model.Bus;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CapacitySelectorTest {

    private final CapacitySelector selector = new CapacitySelector();

    @Test
    void select_filtersBelowRequiredAndSortsDescending() {
        List<Bus> buses = List.of(new Bus(0, 100), new Bus(1, 50), new Bus(2, 200));

        List<Bus> selected = selector.select(buses, 80);

        assertEquals(List.of(new Bus(2, 200), new Bus(0, 100)), selected);
    }

    @Test
    void select_keepsBusExactlyAtRequired() {
        List<Bus> selected = selector.select(List.of(new Bus(3, 80), new Bus(4, 79)), 80);

        assertEquals(List.of(new Bus(3, 80)), selected);
    }

    @Test
    void select_emptyWhenNoCapacity() {
        assertTrue(selector.select(List.of(new Bus(0, 10), new Bus(1, 20)), 1000).isEmpty());
        assertTrue(selector.select(List.of(), 0).isEmpty());
    }
}
