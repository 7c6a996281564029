package opshealth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class OpsHealthApplication {

    public static void main(String[] args) {
        SpringApplication.run(OpsHealthApplication.class, args);
    }

}
