package com.coinbasis;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CoinbasisApplication {

    public static void main(String[] args) {
        SpringApplication.run(CoinbasisApplication.class, args);
    }
}
