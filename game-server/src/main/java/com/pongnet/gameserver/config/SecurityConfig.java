package com.pongnet.gameserver.config;

import com.pongnet.gameserver.security.ChannelKeyStore;
import com.pongnet.gameserver.security.ChannelProperties;
import com.pongnet.gameserver.security.SecureChannel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.crypto.encrypt.AesBytesEncryptor;
import org.springframework.security.crypto.keygen.KeyGenerators;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.crypto.password.Pbkdf2PasswordEncoder;
import org.springframework.security.web.SecurityFilterChain;

import javax.crypto.SecretKey;
import java.io.IOException;
import java.nio.file.Path;

@Configuration
@EnableConfigurationProperties(ChannelProperties.class)
public class SecurityConfig {
    private static final int SALT_BYTES = 16;
    private static final int GCM_IV_BYTES = 16;

    @Bean
    public PasswordEncoder passwordEncoder(@Value("${pong.auth.pbkdf2-iterations:200000}") int iterations) {
        return new Pbkdf2PasswordEncoder("", SALT_BYTES, iterations,
                Pbkdf2PasswordEncoder.SecretKeyFactoryAlgorithm.PBKDF2WithHmacSHA256);
    }

    @Bean
    public SecureChannel secureChannel(ChannelProperties properties) throws IOException {
        SecretKey key = ChannelKeyStore.loadOrCreate(Path.of(properties.keyFile()));
        return new SecureChannel(new AesBytesEncryptor(key, KeyGenerators.secureRandom(GCM_IV_BYTES),
                AesBytesEncryptor.CipherAlgorithm.GCM));
    }

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http.csrf(AbstractHttpConfigurer::disable)
                .httpBasic(AbstractHttpConfigurer::disable)
                .formLogin(AbstractHttpConfigurer::disable)
                .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers(HttpMethod.GET, "/", "/leaderboard", "/api/leaderboard", "/api/health")
                        .permitAll()
                        .requestMatchers("/error").permitAll()
                        .anyRequest().denyAll());
        return http.build();
    }
}
