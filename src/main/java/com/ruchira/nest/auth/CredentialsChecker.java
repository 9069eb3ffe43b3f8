package com.ruchira.nest.auth;

import com.ruchira.nest.config.AuthenticationConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Checks a username and password against the configured credentials.
 */
@Component
@RequiredArgsConstructor
public class CredentialsChecker {

    private final AuthenticationConfig authenticationConfig;

    /**
     * Compares both values in constant time and always evaluates both comparisons,
     * so the response time does not reveal which of the two was wrong.
     */
    public boolean isCorrect(String username, String password) {
        boolean correctUsername = constantTimeEquals(username, authenticationConfig.getUsername());
        boolean correctPassword = constantTimeEquals(password, authenticationConfig.getPassword());

        return correctUsername & correctPassword;
    }

    private static boolean constantTimeEquals(String given, String expected) {
        if (given == null || expected == null) {
            return false;
        }
        return MessageDigest.isEqual(
                given.getBytes(StandardCharsets.UTF_8),
                expected.getBytes(StandardCharsets.UTF_8));
    }
}
