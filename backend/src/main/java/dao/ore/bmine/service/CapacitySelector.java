package dao.ore.bmine.service;

import dao.ore.bmine.model.Bus;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

@Component
public class CapacitySelector {

    /**
     * Buses holding at least {@code required}, richest first. An empty result means no capacity this cycle.
     */
    public List<Bus> select(List<Bus> buses, long required) {
        return buses.stream()
                .filter(bus -> bus.rewardsAvailable() >= required)
                .sorted(Comparator.comparingLong(Bus::rewardsAvailable).reversed())
                .toList();
    }
}
