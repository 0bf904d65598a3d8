package com.work.healthcheck;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot 启动入口。作业中的每个进程各运行一个实例，
 * rank / worldSize / localWorldSize 通常由启动器经环境变量注入。
 */
@SpringBootApplication
public class HealthcheckDemoApplication {

    public static void main(String[] args) {
        SpringApplication.run(HealthcheckDemoApplication.class, args);
    }
}
