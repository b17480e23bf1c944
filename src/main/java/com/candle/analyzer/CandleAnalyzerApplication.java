package com.candle.analyzer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CandleAnalyzerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CandleAnalyzerApplication.class, args);
    }
}
