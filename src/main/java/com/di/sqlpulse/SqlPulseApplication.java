package com.di.sqlpulse;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Monitored databases and the optional durable store get their own pools
 * (TargetDataSourceRegistry, StorageDataSourceConfig), so the default DataSource is off.
 */
@SpringBootApplication(exclude = {
		DataSourceAutoConfiguration.class,
		DataSourceTransactionManagerAutoConfiguration.class
})
@ConfigurationPropertiesScan
public class SqlPulseApplication {

	public static void main(String[] args) {
		SpringApplication.run(SqlPulseApplication.class, args);
	}
}
