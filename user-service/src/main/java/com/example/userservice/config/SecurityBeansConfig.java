package com.example.userservice.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * Credential hashing.
 * Passwords are stored as BCrypt digests only.
 */
@Configuration
@EnableConfigurationProperties(UserAccountProperties.class)
public class SecurityBeansConfig {

    @Bean
    public PasswordEncoder passwordEncoder(UserAccountProperties properties) {
        return new BCryptPasswordEncoder(properties.getBcryptStrength());
    }
}
