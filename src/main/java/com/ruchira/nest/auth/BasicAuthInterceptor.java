package com.ruchira.nest.auth;

import com.ruchira.nest.exception.AuthenticationException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static com.ruchira.nest.constant.Constants.BASIC_AUTH_SCHEME;
import static com.ruchira.nest.constant.Constants.INCORRECT_CREDENTIALS_MESSAGE;

/**
 * Rejects requests without valid HTTP Basic credentials before the handler
 * (and its request body) is touched.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BasicAuthInterceptor implements HandlerInterceptor {

    private final CredentialsChecker credentialsChecker;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        String[] credentials = decode(authorization);

        if (credentials == null || !credentialsChecker.isCorrect(credentials[0], credentials[1])) {
            log.warn("Rejected {} {} from {}: bad or missing credentials",
                    request.getMethod(), request.getRequestURI(), request.getRemoteAddr());
            throw new AuthenticationException(INCORRECT_CREDENTIALS_MESSAGE);
        }
        return true;
    }

    /**
     * @return username and password, or null when the header is absent or malformed
     */
    private String[] decode(String authorization) {
        String prefix = BASIC_AUTH_SCHEME + " ";
        if (!StringUtils.startsWithIgnoreCase(authorization, prefix)) {
            return null;
        }

        String decoded;
        try {
            byte[] bytes = Base64.getDecoder().decode(authorization.substring(prefix.length()).trim());
            decoded = new String(bytes, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            log.debug("Malformed basic credentials: {}", e.getMessage());
            return null;
        }

        if (!decoded.contains(":")) {
            return null;
        }
        return new String[]{
                StringUtils.substringBefore(decoded, ":"),
                StringUtils.substringAfter(decoded, ":")
        };
    }
}
