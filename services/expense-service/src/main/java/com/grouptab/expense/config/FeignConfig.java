package com.grouptab.expense.config;

import org.springframework.cloud.openfeign.EnableFeignClients;
import org.springframework.context.annotation.Configuration;

/**
 * Feign client registration
 */
@Configuration
@EnableFeignClients(basePackages = "com.grouptab.expense.client")
public class FeignConfig {
}
