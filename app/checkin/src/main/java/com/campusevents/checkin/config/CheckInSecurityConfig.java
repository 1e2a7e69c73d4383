package com.campusevents.checkin.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.intercept.AuthorizationFilter;

@Configuration
@EnableConfigurationProperties(CheckInInternalApiProperties.class)
public class CheckInSecurityConfig {

  @Bean
  GatewayAuthenticationFilter gatewayAuthenticationFilter(
      CheckInInternalApiProperties properties) {
    return new GatewayAuthenticationFilter(properties);
  }

  @Bean
  SecurityFilterChain securityFilterChain(
      HttpSecurity http, GatewayAuthenticationFilter gatewayAuthenticationFilter)
      throws Exception {
    http.csrf(csrf -> csrf.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .addFilterBefore(gatewayAuthenticationFilter, AuthorizationFilter.class)
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers(
                        "/error", "/actuator/health", "/actuator/health/**", "/actuator/info")
                    .permitAll()
                    .requestMatchers(HttpMethod.POST, "/v1/check-ins")
                    .hasAnyRole(GatewayRoles.STAFF, GatewayRoles.ADMIN)
                    .requestMatchers("/v1/admin/**")
                    .hasRole(GatewayRoles.ADMIN)
                    .requestMatchers(HttpMethod.POST, "/v1/registrations/{registrationId}/void")
                    .hasRole(GatewayRoles.ADMIN)
                    .requestMatchers(HttpMethod.GET, "/v1/registrations/{registrationId}/check-ins")
                    .hasRole(GatewayRoles.ADMIN)
                    .requestMatchers(HttpMethod.GET, "/v1/events/{eventId}/report")
                    .hasRole(GatewayRoles.ADMIN)
                    .anyRequest()
                    .authenticated());
    return http.build();
  }
}
