package com.williamcallahan.chapter_sync_engine.config;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.Ordered;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Normalizes SPRING_DATASOURCE_URL values provided as Postgres URI (postgres://...)
 * into a JDBC URL (jdbc:postgresql://...).
 *
 * Also sets spring.datasource.username and spring.datasource.password from the URI
 * user-info if not already provided by higher-precedence sources. Values that do not
 * parse are left as-is so the datasource reports the problem at connect time.
 */
public final class DatabaseUrlEnvironmentPostProcessor implements EnvironmentPostProcessor, Ordered {

    static final String DS_URL = "spring.datasource.url";
    static final String DS_USERNAME = "spring.datasource.username";
    static final String DS_PASSWORD = "spring.datasource.password";
    private static final String ENV_DS_URL = "SPRING_DATASOURCE_URL";
    private static final String HIKARI_JDBC_URL = "spring.datasource.hikari.jdbc-url";
    private static final String DS_DRIVER = "spring.datasource.driver-class-name";
    private static final int DEFAULT_PORT = 5432;

    record JdbcSettings(String jdbcUrl, String username, String password) {}

    @Override
    public void postProcessEnvironment(ConfigurableEnvironment environment, SpringApplication application) {
        String url = environment.getProperty(DS_URL);
        if (url == null || url.isBlank()) {
            url = environment.getProperty(ENV_DS_URL);
        }
        Optional<JdbcSettings> settings = toJdbc(url);
        if (settings.isEmpty()) {
            return;
        }

        Map<String, Object> overrides = new HashMap<>();
        overrides.put(DS_URL, settings.get().jdbcUrl());
        overrides.put(HIKARI_JDBC_URL, settings.get().jdbcUrl());
        overrides.put(DS_DRIVER, "org.postgresql.Driver");
        putIfMissing(environment, overrides, DS_USERNAME, settings.get().username());
        putIfMissing(environment, overrides, DS_PASSWORD, settings.get().password());
        environment.getPropertySources().addFirst(new MapPropertySource("databaseUrlProcessor", overrides));
    }

    /**
     * Converts a postgres:// or postgresql:// URI; anything else yields empty.
     */
    static Optional<JdbcSettings> toJdbc(String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        String lower = url.trim().toLowerCase(Locale.ROOT);
        if (!lower.startsWith("postgres://") && !lower.startsWith("postgresql://")) {
            return Optional.empty();
        }
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            return Optional.empty();
        }
        if (uri.getHost() == null) {
            return Optional.empty();
        }

        String path = uri.getRawPath();
        String database = path == null || path.length() <= 1 ? "postgres" : path.substring(1);
        int port = uri.getPort() > 0 ? uri.getPort() : DEFAULT_PORT;
        StringBuilder jdbc = new StringBuilder("jdbc:postgresql://")
            .append(uri.getHost()).append(':').append(port).append('/').append(database);
        if (uri.getRawQuery() != null && !uri.getRawQuery().isBlank()) {
            jdbc.append('?').append(uri.getRawQuery());
        }

        String username = null;
        String password = null;
        String userInfo = uri.getRawUserInfo();
        if (userInfo != null && !userInfo.isBlank()) {
            int colon = userInfo.indexOf(':');
            username = decode(colon >= 0 ? userInfo.substring(0, colon) : userInfo);
            password = colon >= 0 ? decode(userInfo.substring(colon + 1)) : null;
        }
        return Optional.of(new JdbcSettings(jdbc.toString(), username, password));
    }

    private static void putIfMissing(ConfigurableEnvironment environment, Map<String, Object> overrides,
                                     String key, String value) {
        String existing = environment.getProperty(key);
        if ((existing == null || existing.isBlank()) && value != null && !value.isBlank()) {
            overrides.put(key, value);
        }
    }

    private static String decode(String value) {
        return URLDecoder.decode(value, StandardCharsets.UTF_8);
    }

    @Override
    public int getOrder() {
        return Ordered.HIGHEST_PRECEDENCE;
    }
}
