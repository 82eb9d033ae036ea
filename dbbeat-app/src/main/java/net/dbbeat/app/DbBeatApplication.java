package net.dbbeat.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class DbBeatApplication {
    public static void main(String[] args) {
        SpringApplication.run(DbBeatApplication.class, args);
    }
}
