package com.acme.brewbucks.worker.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import lombok.extern.slf4j.Slf4j;

/** Connection pool for the JDBC document store. Only created when that store is selected. */
@Factory
@Requires(property = "storage.backend", value = "jdbc")
@Slf4j
public class DataSourceFactory {

  @Singleton
  @ConfigurationProperties("datasource")
  public DatasourceConfig datasourceConfig() {
    return new DatasourceConfig();
  }

  @Singleton
  @Bean(preDestroy = "close")
  public HikariDataSource dataSource(DatasourceConfig config) {
    if (config.getUrl() == null || config.getUrl().isBlank()) {
      throw new IllegalStateException("datasource.url must be set when storage.backend is jdbc");
    }
    HikariConfig hikari = new HikariConfig();
    hikari.setJdbcUrl(config.getUrl());
    hikari.setUsername(config.getUsername());
    hikari.setPassword(config.getPassword());
    if (config.getDriverClassName() != null) {
      hikari.setDriverClassName(config.getDriverClassName());
    }
    hikari.setMaximumPoolSize(config.getMaximumPoolSize());
    hikari.setPoolName("brewbucks-documents");
    log.info("Connecting document store to {}", config.getUrl());
    return new HikariDataSource(hikari);
  }
}
