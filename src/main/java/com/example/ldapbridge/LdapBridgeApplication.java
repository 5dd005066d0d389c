package com.example.ldapbridge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LdapBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(LdapBridgeApplication.class, args);
    }
}
