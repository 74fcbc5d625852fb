package com.purchasingpower.remediation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SecureRemediationApplication {

    public static void main(String[] args) {
        SpringApplication.run(SecureRemediationApplication.class, args);
    }
}
