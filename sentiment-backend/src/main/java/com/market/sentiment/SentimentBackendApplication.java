package com.market.sentiment;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling // 定时触发入口，cron 为 "-" 时不生效
@ConfigurationPropertiesScan
public class SentimentBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(SentimentBackendApplication.class, args);
    }

}
