package uz.greenwhite.federation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class FederationGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(FederationGatewayApplication.class, args);
    }
}
