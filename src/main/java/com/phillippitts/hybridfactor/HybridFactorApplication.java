package com.phillippitts.hybridfactor;

import com.phillippitts.hybridfactor.config.properties.FactorizationProperties;
import com.phillippitts.hybridfactor.config.properties.WorkerExecutorProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        FactorizationProperties.class,
        WorkerExecutorProperties.class
})
public class HybridFactorApplication {

    public static void main(String[] args) {
        SpringApplication.run(HybridFactorApplication.class, args);
    }

}
