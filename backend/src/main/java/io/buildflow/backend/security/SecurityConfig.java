package io.buildflow.backend.security;

import io.buildflow.backend.multitenancy.TenantFilter;
import io.buildflow.backend.multitenancy.TenantLoggingFilter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

@Configuration
@EnableWebSecurity
public class SecurityConfig {

  private final ApiKeyAuthFilter apiKeyAuthFilter;
  private final TenantFilter tenantFilter;
  private final SessionAuthFilter sessionAuthFilter;
  private final TenantLoggingFilter tenantLoggingFilter;

  public SecurityConfig(
      ApiKeyAuthFilter apiKeyAuthFilter,
      TenantFilter tenantFilter,
      SessionAuthFilter sessionAuthFilter,
      TenantLoggingFilter tenantLoggingFilter) {
    this.apiKeyAuthFilter = apiKeyAuthFilter;
    this.tenantFilter = tenantFilter;
    this.sessionAuthFilter = sessionAuthFilter;
    this.tenantLoggingFilter = tenantLoggingFilter;
  }

  /**
   * Internal endpoints ({@code /internal/**}) authenticate with the API key. Agency endpoints
   * ({@code /api/**}) resolve the agency database first, then the bearer session.
   */
  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
    http.csrf(csrf -> csrf.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers("/actuator/**")
                    .permitAll()
                    .requestMatchers("/internal/**")
                    .authenticated()
                    .requestMatchers("/api/**")
                    .authenticated()
                    .anyRequest()
                    .denyAll())
        .addFilterBefore(apiKeyAuthFilter, UsernamePasswordAuthenticationFilter.class)
        .addFilterAfter(tenantFilter, ApiKeyAuthFilter.class)
        .addFilterAfter(sessionAuthFilter, TenantFilter.class)
        .addFilterAfter(tenantLoggingFilter, SessionAuthFilter.class);

    return http.build();
  }

  @Bean
  public PasswordEncoder passwordEncoder() {
    return new BCryptPasswordEncoder();
  }
}
