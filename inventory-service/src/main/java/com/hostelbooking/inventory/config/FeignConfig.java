package com.hostelbooking.inventory.config;

import org.springframework.cloud.openfeign.EnableFeignClients;
import org.springframework.context.annotation.Configuration;

/**
 * Outbound calendar feed clients. Not on the application class, so JPA slice tests skip them.
 */
@Configuration
@EnableFeignClients(basePackages = "com.hostelbooking.inventory.calendar")
public class FeignConfig {
}
