package com.dividendcapture;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DividendCaptureApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(DividendCaptureApplication.class, args)));
    }
}
