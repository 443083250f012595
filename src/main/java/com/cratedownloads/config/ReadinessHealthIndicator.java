package com.cratedownloads.config;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

@Component
public class ReadinessHealthIndicator implements HealthIndicator {

    private final DataSource dataSource;

    public ReadinessHealthIndicator(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Health health() {
        try (Connection connection = dataSource.getConnection()) {
            if (connection.isValid(5)) {
                return Health.up()
                        .withDetail("database", "UP")
                        .withDetail("readOnly", connection.isReadOnly())
                        .build();
            }
            return Health.down()
                    .withDetail("database", "DOWN")
                    .withDetail("connection", "Invalid")
                    .build();
        } catch (SQLException e) {
            return Health.down()
                    .withDetail("database", "DOWN")
                    .withDetail("error", e.getMessage())
                    .build();
        }
    }
}
