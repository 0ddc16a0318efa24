package com.paymentsengine.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.PrintStream;

/**
 * Where the account snapshot is written. Logs go to stderr, so stdout carries data only.
 */
@Configuration
public class OutputConfig {

    @Bean
    public PrintStream accountOutput() {
        return System.out;
    }
}
