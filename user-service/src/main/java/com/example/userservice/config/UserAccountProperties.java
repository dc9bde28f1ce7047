package com.example.userservice.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Account settings, bound from {@code user-service.accounts.*}.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "user-service.accounts")
public class UserAccountProperties {

    /**
     * BCrypt log rounds.
     */
    @Min(4)
    @Max(31)
    private int bcryptStrength = 10;

    /**
     * Length of generated passwords on reset.
     */
    @Min(6)
    private int resetPasswordLength = 10;
}
