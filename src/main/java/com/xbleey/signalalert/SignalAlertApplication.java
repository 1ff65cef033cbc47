package com.xbleey.signalalert;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.mybatis.spring.annotation.MapperScan;

@SpringBootApplication
@EnableScheduling
@MapperScan("com.xbleey.signalalert.mapper")
public class SignalAlertApplication {

    public static void main(String[] args) {
        SpringApplication.run(SignalAlertApplication.class, args);
    }

}
