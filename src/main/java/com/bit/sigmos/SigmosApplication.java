package com.bit.sigmos;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@Slf4j
@SpringBootApplication(scanBasePackages = "com.bit.sigmos")
public class SigmosApplication {
    public static void main(String[] args) {
        SpringApplication.run(SigmosApplication.class, args);
    }
    //二进制统一大端
}
