package com.quarry.storage.clickhouse;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * Configuration for the ClickHouse JDBC connection pool the query runner reads through
 */
@Configuration
public class ClickHouseConfig {
    private static final Logger logger = LoggerFactory.getLogger(ClickHouseConfig.class);

    @Value("${quarry.storage.clickhouse.url:jdbc:clickhouse://localhost:8123/default}")
    private String url;

    @Value("${quarry.storage.clickhouse.username:default}")
    private String username;

    @Value("${quarry.storage.clickhouse.password:}")
    private String password;

    @Value("${quarry.storage.clickhouse.pool.size:10}")
    private int poolSize;

    @Value("${quarry.storage.clickhouse.max-execution-time-seconds:30}")
    private int maxExecutionTimeSeconds;

    /**
     * Create ClickHouse DataSource with connection pooling
     */
    @Bean(name = "clickHouseDataSource")
    public DataSource clickHouseDataSource() {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(url);
        config.setUsername(username);
        config.setPassword(password);
        config.setDriverClassName("com.clickhouse.jdbc.ClickHouseDriver");

        // Connection pool settings
        config.setMaximumPoolSize(poolSize);
        config.setMinimumIdle(2);
        config.setConnectionTimeout(30000);
        config.setIdleTimeout(600000);
        config.setMaxLifetime(1800000);
        // pool starts even when the store is down; queries fail until it is back
        config.setInitializationFailTimeout(-1);

        // ClickHouse-specific settings
        config.addDataSourceProperty("socket_timeout", String.valueOf((maxExecutionTimeSeconds + 5) * 1000));
        config.addDataSourceProperty("compress", "true");
        config.addDataSourceProperty("max_execution_time", String.valueOf(maxExecutionTimeSeconds));

        HikariDataSource dataSource = new HikariDataSource(config);
        logger.info("ClickHouse DataSource initialized: {}", url);
        return dataSource;
    }

    /**
     * Create JdbcTemplate for ClickHouse reads
     */
    @Bean(name = "clickHouseJdbcTemplate")
    public JdbcTemplate clickHouseJdbcTemplate(@Qualifier("clickHouseDataSource") DataSource clickHouseDataSource) {
        return new JdbcTemplate(clickHouseDataSource);
    }
}
