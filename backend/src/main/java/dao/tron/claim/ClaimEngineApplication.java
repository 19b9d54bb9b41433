package dao.tron.claim;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ClaimEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClaimEngineApplication.class, args);
    }
}
