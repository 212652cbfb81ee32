package health.assist;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HealthAssistApplication {
    public static void main(String[] args) {
        SpringApplication.run(HealthAssistApplication.class, args);
    }
}
