package dao.ore.bmine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class BundleMinerApplication {
    public static void main(String[] args) {
        SpringApplication.run(BundleMinerApplication.class, args);
    }
}
