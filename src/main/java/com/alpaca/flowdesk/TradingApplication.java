package com.alpaca.flowdesk;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TradingApplication {
    public static void main(String[] args) { SpringApplication.run(TradingApplication.class, args); }
}
