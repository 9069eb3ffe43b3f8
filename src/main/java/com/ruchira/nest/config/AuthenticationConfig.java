package com.ruchira.nest.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Credentials accepted by the transformation endpoint
 * Supplied through application.yml, normally from TRANSFORMATION_USERNAME / TRANSFORMATION_PASSWORD
 */
@Configuration
@ConfigurationProperties(prefix = "app.auth")
@Data
public class AuthenticationConfig {

    private String username;
    private String password;
}
