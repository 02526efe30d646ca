package dao.ore.bmine.config;

import dao.ore.bmine.service.LocalProofSolver;
import dao.ore.bmine.service.ProcessProofSolver;
import dao.ore.bmine.service.ProofSolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class SolverConfig {

    @Bean
    public ProofSolver proofSolver(SolverProperties props) {
        if (props.getType() == SolverProperties.Type.LOCAL) {
            log.info("Using in-process keccak solver");
            return new LocalProofSolver();
        }
        String path = props.isUseGpu() ? props.getGpuWorkerPath() : props.getCpuWorkerPath();
        log.info("Using nonce worker: {}", path);
        return new ProcessProofSolver(path);
    }
}
