package com.helia;

import lombok.extern.slf4j.Slf4j;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
@MapperScan(basePackages = "com.helia.mapper")
@Slf4j
public class HeliaChatApplication {

    public static void main(String[] args) {
        log.info("Starting Helia chat backend");
        SpringApplication.run(HeliaChatApplication.class, args);
        log.info("Helia chat backend started");
    }
}
