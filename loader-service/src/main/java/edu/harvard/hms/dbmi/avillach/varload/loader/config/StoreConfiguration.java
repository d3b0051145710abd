package edu.harvard.hms.dbmi.avillach.varload.loader.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;

/**
 * The target store connection. Connections are opened on first use, so a TRANSFORM-only run never
 * touches the database.
 */
@Configuration
public class StoreConfiguration {

    @Bean
    public DataSource variantStoreDataSource(LoaderConfig config) {
        LoaderConfig.Datasource settings = config.getDatasource();
        return new DriverManagerDataSource(settings.getUrl(), settings.getUsername(), settings.getPassword());
    }
}
