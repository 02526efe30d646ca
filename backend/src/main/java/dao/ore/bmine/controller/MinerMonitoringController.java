package dao.ore.bmine.controller;

import dao.ore.bmine.config.SchedulerProperties;
import dao.ore.bmine.model.MiningMode;
import dao.ore.bmine.model.TipSnapshot;
import dao.ore.bmine.service.MinerStats;
import dao.ore.bmine.service.ResourcePool;
import dao.ore.bmine.tips.TipFeed;
import dao.ore.bmine.util.OreUnits;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only view of the running miner.
 */
@Slf4j
@RestController
@RequestMapping("/api/monitor")
public class MinerMonitoringController {

    private final SchedulerProperties schedulerProps;
    private final TipFeed tipFeed;
    private final ResourcePool pool;
    private final MinerStats stats;

    public MinerMonitoringController(SchedulerProperties schedulerProps,
                                     TipFeed tipFeed,
                                     ResourcePool pool,
                                     MinerStats stats) {
        this.schedulerProps = schedulerProps;
        this.tipFeed = tipFeed;
        this.pool = pool;
        this.stats = stats;
    }

    /**
     * GET /api/monitor/status
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> getStatus() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("mode", schedulerProps.getMode());

        TipSnapshot tips = tipFeed.current();
        Map<String, Object> tipInfo = new LinkedHashMap<>();
        tipInfo.put("p25", tips.p25());
        tipInfo.put("p50", tips.p50());
        tipInfo.put("p75", tips.p75());
        tipInfo.put("p95", tips.p95());
        tipInfo.put("p99", tips.p99());
        response.put("tips", tipInfo);

        if (schedulerProps.getMode() == MiningMode.POOLED) {
            response.put("pool", Map.of(
                    "idleIdentities", pool.idleIdentities(),
                    "parkedBatches", pool.parkedBatches(),
                    "inFlightBatches", pool.inFlightBatches()
            ));
        }

        response.put("statistics", Map.of(
                "landed", stats.getLanded(),
                "dropped", stats.getDropped(),
                "totalRewards", OreUnits.format(stats.getTotalRewards())
        ));
        return ResponseEntity.ok(response);
    }
}
