package com.gt.curator.conf;

import com.gt.curator.item.ItemStore;
import com.gt.curator.item.impl.ItemStorePG;
import com.gt.curator.reviewSession.ReviewEventStore;
import com.gt.curator.reviewSession.impl.ReviewEventStorePG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;

@Configuration
public class PGBeanConfig {

    @Bean
    public DataSource getDataSource(@Value("${curator.datasource.postgres.url}") String url,
                                    @Value("${curator.datasource.postgres.username}") String username,
                                    @Value("${curator.datasource.postgres.password}") String password) {
        return new DriverManagerDataSource(url, username, password);
    }

    @Bean
    public NamedParameterJdbcTemplate getNamedParameterJdbcTemplate(DataSource dataSource) {

        return new NamedParameterJdbcTemplate(dataSource);
    }

    @Bean
    public PlatformTransactionManager getTransactionManager(DataSource dataSource) {
        return new DataSourceTransactionManager(dataSource);
    }

    @Bean
    public TransactionTemplate getTransactionTemplate(PlatformTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }

    @Bean
    public ItemStore getItemStore(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new ItemStorePG(namedParameterJdbcTemplate);
    }

    @Bean
    public ReviewEventStore getReviewEventStore(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new ReviewEventStorePG(namedParameterJdbcTemplate);
    }
}
