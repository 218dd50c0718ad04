package workhub.workhubbackend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WorkhubBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(WorkhubBackendApplication.class, args);
    }
}
