package com.injuryelo.injury;

import com.injuryelo.injury.config.InjuryProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(InjuryProperties.class)
public class InjuryServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(InjuryServiceApplication.class, args);
    }
}
