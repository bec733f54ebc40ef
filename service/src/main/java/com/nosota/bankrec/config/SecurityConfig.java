package com.nosota.bankrec.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;

/**
 * Reconciliation and bank account endpoints are open; authentication is expected in front
 * of the service and the acting user arrives as {@code actorId} in each request.
 * API docs are served only with the {@code dev} profile. Everything else is denied.
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

    private static final String[] API_PATHS = {"/api/v1/reconciliation/**", "/api/v1/bank-accounts/**", "/error"};
    private static final String[] DOC_PATHS = {"/v3/api-docs/**", "/swagger-ui/**", "/swagger-ui.html"};

    private final Environment environment;

    public SecurityConfig(Environment environment) {
        this.environment = environment;
    }

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        boolean docsEnabled = environment.acceptsProfiles(Profiles.of("dev"));
        return http
                .authorizeHttpRequests(auth -> {
                    auth.requestMatchers(API_PATHS).permitAll();
                    if (docsEnabled) {
                        auth.requestMatchers(DOC_PATHS).permitAll();
                    }
                    auth.anyRequest().denyAll();
                })
                .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .csrf(AbstractHttpConfigurer::disable)
                .build();
    }
}
