package com.scorebook.gamestate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GameStateApplication {

    public static void main(String[] args) {
        SpringApplication.run(GameStateApplication.class, args);
    }
}
