package com.aiinpocket.choretrust;

import com.aiinpocket.choretrust.config.ChoreTrustProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ChoreTrustProperties.class)
public class ChoreTrustApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChoreTrustApplication.class, args);
    }

}
