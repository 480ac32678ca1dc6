package com.flowo.live;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.r2dbc.R2dbcAutoConfiguration;

// The change feed opens its own dedicated connection; no pooled R2DBC ConnectionFactory is wanted.
@SpringBootApplication(scanBasePackages = "com.flowo.live", exclude = R2dbcAutoConfiguration.class)
public class LiveHubApplication {
    public static void main(String[] args) {
        SpringApplication.run(LiveHubApplication.class, args);
    }
}
