package fr.imt.pbdeployer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PbDeployerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PbDeployerApplication.class, args);
    }

}
