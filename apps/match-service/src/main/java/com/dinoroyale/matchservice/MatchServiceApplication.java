package com.dinoroyale.matchservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * match-service 启动入口。
 * 单进程承载一局大逃杀对局：阶段状态机、缩圈与胜负判定都在本进程内完成。
 */
@SpringBootApplication
public class MatchServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(MatchServiceApplication.class, args);
    }
}
