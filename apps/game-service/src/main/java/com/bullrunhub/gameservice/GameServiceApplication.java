package com.bullrunhub.gameservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * game-service 启动入口。
 * 通过 @EnableScheduling 启用空闲房间清扫等周期任务。
 */
@SpringBootApplication
@EnableScheduling
public class GameServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(GameServiceApplication.class, args);
    }
}
