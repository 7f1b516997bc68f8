package org.nowstart.spxsignal;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan(basePackages = "org.nowstart.spxsignal.data.property")
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }
}
