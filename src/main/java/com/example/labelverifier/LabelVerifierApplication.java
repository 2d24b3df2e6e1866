package com.example.labelverifier;

import com.example.labelverifier.config.VerificationProperties;
import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Contact;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@OpenAPIDefinition(
        info = @Info(
                title = "Beverage Label Verifier API",
                version = "1.0",
                description = "REST API that reads beverage label images and checks them against submitted regulatory fields.",
                contact = @Contact(name = "Beverage Label Verifier")))
@SpringBootApplication
@EnableConfigurationProperties(VerificationProperties.class)
public class LabelVerifierApplication {

    public static void main(String[] args) {
        SpringApplication.run(LabelVerifierApplication.class, args);
    }
}
