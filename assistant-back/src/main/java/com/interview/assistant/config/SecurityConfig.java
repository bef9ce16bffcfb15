package com.interview.assistant.config;

import com.interview.assistant.common.ErrorResponseWriter;
import com.interview.assistant.common.error.AuthenticationFailedException;
import com.interview.assistant.common.error.AuthenticationFailedException.Reason;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import java.util.Arrays;
import java.util.List;

@Configuration
@RequiredArgsConstructor
public class SecurityConfig {

    private final JWTAuthenticationFilter jwtFilter;
    private final ErrorResponseWriter errorResponseWriter;

    //  CORS 설정 Bean
    @Bean
    public CorsConfigurationSource corsConfigurationSource(CorsProps props) {
        CorsConfiguration config = new CorsConfiguration();
        config.setAllowedOrigins(split(props.getAllowedOrigins()));
        // 와일드카드 origin 과 함께 쓸 수 없으므로 credentials 는 끔
        config.setAllowCredentials(false);
        config.setAllowedMethods(split(props.getAllowedMethods()));
        config.setAllowedHeaders(split(props.getAllowedHeaders()));

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", config);
        return source;
    }

    // 필터는 시큐리티 체인 안에서만 돌도록 서블릿 자동 등록을 끈다
    @Bean
    public FilterRegistrationBean<JWTAuthenticationFilter> jwtFilterRegistration() {
        FilterRegistrationBean<JWTAuthenticationFilter> registration = new FilterRegistrationBean<>(jwtFilter);
        registration.setEnabled(false);
        return registration;
    }

    @Bean
    public AuthenticationEntryPoint bearerEntryPoint() {
        return (req, res, ex) -> {
            Object failure = req.getAttribute(JWTAuthenticationFilter.AUTH_FAILURE_ATTR);
            AuthenticationFailedException e = failure instanceof AuthenticationFailedException f
                    ? f
                    : new AuthenticationFailedException(Reason.MISSING);
            errorResponseWriter.write(res, e);
        };
    }

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http,
                                           @Qualifier("corsConfigurationSource") CorsConfigurationSource corsConfigurationSource,
                                           AuthenticationEntryPoint bearerEntryPoint) throws Exception {
        http
            .csrf(csrf -> csrf.disable())
            .cors(cors -> cors.configurationSource(corsConfigurationSource))
            .sessionManagement(s -> s.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .authorizeHttpRequests(auth -> auth
                // 프리플라이트는 무조건 통과
                .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
                .requestMatchers("/health", "/auth/signup", "/auth/login", "/error").permitAll()
                .anyRequest().authenticated()
            )
            .exceptionHandling(ex -> ex.authenticationEntryPoint(bearerEntryPoint))
            .addFilterBefore(jwtFilter, UsernamePasswordAuthenticationFilter.class)
            .httpBasic(h -> h.disable())
            .formLogin(f -> f.disable());

        return http.build();
    }

    private static List<String> split(String csv) {
        return Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
