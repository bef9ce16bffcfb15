package com.interview.assistant.config;

import com.interview.assistant.security.PasslibPbkdf2PasswordEncoder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;

@Configuration
public class SecurityBeansConfig {

    @Bean
    public PasswordEncoder passwordEncoder(PasswordProps props) {
        // users.csv 는 passlib pbkdf2_sha256 형식 그대로 유지 ($pbkdf2-sha256$rounds$salt$digest)
        return new PasslibPbkdf2PasswordEncoder(props.getSaltLength(), props.getIterations());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
