package dao.ore.bmine.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "solver")
@Data
public class SolverProperties {

    public enum Type {
        /** External nonce-worker process speaking the stdin/stdout byte protocol. */
        PROCESS,
        /** In-JVM keccak search. */
        LOCAL
    }

    private Type type = Type.PROCESS;

    /**
     * CPU nonce-worker binary.
     */
    private String cpuWorkerPath = "./nonce-worker";

    /**
     * GPU nonce-worker binary.
     */
    private String gpuWorkerPath = "./nonce-worker-gpu";

    /**
     * Use the GPU binary. Pooled mode is normally run on GPU.
     */
    private boolean useGpu = false;
}
