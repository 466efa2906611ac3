package com.teamsbot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TeamsBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(TeamsBotApplication.class, args);
    }
}
