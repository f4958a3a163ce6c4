package com.parley.security;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.oauth2.server.resource.web.BearerTokenResolver;
import org.springframework.security.oauth2.server.resource.web.DefaultBearerTokenResolver;
import org.springframework.security.web.SecurityFilterChain;

/**
 * Provider webhooks authenticate themselves inside the channel adapters, so
 * {@code /inbound/**} is open at this layer. The web channel is the exception: it is
 * posted by our own front end with a bearer JWT from the identity provider.
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

    static final String WEB_CHANNEL_PATH = "/inbound/web";

    @Bean
    public SecurityFilterChain inboundFilterChain(HttpSecurity http) throws Exception {
        return http
                .oauth2ResourceServer(oauth2 -> oauth2
                        .bearerTokenResolver(webChannelBearerTokenResolver())
                        .jwt(Customizer.withDefaults())
                )
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers("/actuator/health", "/actuator/health/**", "/actuator/info").permitAll()
                        .requestMatchers(HttpMethod.POST, WEB_CHANNEL_PATH).authenticated()
                        .requestMatchers("/inbound/**").permitAll()
                        .anyRequest().authenticated()
                )
                .sessionManagement(session -> session
                        .sessionCreationPolicy(SessionCreationPolicy.STATELESS)
                )
                .csrf(csrf -> csrf
                        .ignoringRequestMatchers("/inbound/**")
                )
                .build();
    }

    /**
     * Provider webhooks such as Apple Messages for Business also send
     * {@code Authorization: Bearer}, signed by the provider rather than our identity
     * provider. Only the web channel and non-webhook paths resolve a bearer token here.
     */
    static BearerTokenResolver webChannelBearerTokenResolver() {
        DefaultBearerTokenResolver delegate = new DefaultBearerTokenResolver();
        return request -> isProviderWebhook(request) ? null : delegate.resolve(request);
    }

    static boolean isProviderWebhook(HttpServletRequest request) {
        String path = request.getRequestURI();
        return path != null && path.startsWith("/inbound/") && !path.equals(WEB_CHANNEL_PATH);
    }
}
