package madn.core;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MadnCoreApplication {
    public static void main(String[] args) {
        SpringApplication.run(MadnCoreApplication.class, args);
    }
}
