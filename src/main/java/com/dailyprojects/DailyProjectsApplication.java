package com.dailyprojects;

import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

@SpringBootApplication
public class DailyProjectsApplication {

    public static void main(String[] args) {
        new SpringApplicationBuilder(DailyProjectsApplication.class)
                .properties(
                        "spring.main.web-application-type=servlet",
                        "spring.main.banner-mode=off"
                )
                .run(args);
    }
}
