package ru.javaboys.skillmatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class SkillMatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(SkillMatchApplication.class, args);
    }
}
