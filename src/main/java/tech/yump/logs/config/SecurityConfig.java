package tech.yump.logs.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import tech.yump.logs.audit.AuditBackend;
import tech.yump.logs.auth.ApiKeyAuthFilter;

@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
@Slf4j
public class SecurityConfig {

  private final LiteLogsProperties properties;
  private final AuditBackend auditBackend;
  private final ObjectMapper objectMapper;

  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
    http
            .csrf(AbstractHttpConfigurer::disable)
            .formLogin(AbstractHttpConfigurer::disable)
            .httpBasic(AbstractHttpConfigurer::disable)
            .logout(AbstractHttpConfigurer::disable)
            .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .exceptionHandling(ex -> ex.authenticationEntryPoint(new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED)));

    // Created here rather than as a bean so the servlet container does not register it a second time
    ApiKeyAuthFilter apiKeyAuthFilter = new ApiKeyAuthFilter(properties.auth().apiKey(), auditBackend, objectMapper);
    http.addFilterBefore(apiKeyAuthFilter, UsernamePasswordAuthenticationFilter.class);

    if (apiKeyAuthFilter.isEnabled()) {
      log.info("Configuring Spring Security with API-key checks on write requests.");
      http.authorizeHttpRequests(authz -> authz
              .requestMatchers("/", "/error").permitAll()
              .requestMatchers("/actuator/health/**", "/actuator/info").permitAll()
              .requestMatchers(HttpMethod.POST, "/api/logs/**").authenticated()
              .requestMatchers(HttpMethod.PUT, "/api/logs/**").authenticated()
              .requestMatchers(HttpMethod.PATCH, "/api/logs/**").authenticated()
              .requestMatchers(HttpMethod.DELETE, "/api/logs/**").authenticated()
              .anyRequest().permitAll()
      );
    } else {
      log.warn("LiteLogs API-key authentication is disabled via configuration (litelogs.auth.api-key.enabled=false). Uploads and re-sanitize are open to anyone. THIS IS INSECURE FOR PRODUCTION.");
      http.authorizeHttpRequests(authz -> authz.anyRequest().permitAll());
    }

    return http.build();
  }
}
