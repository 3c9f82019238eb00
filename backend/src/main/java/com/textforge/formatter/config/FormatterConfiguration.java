package com.textforge.formatter.config;

import com.textforge.formatter.html.HtmlFormatter;
import com.textforge.formatter.sql.SqlDialect;
import com.textforge.formatter.sql.SqlFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class FormatterConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(FormatterConfiguration.class);

    @Bean
    public SqlDialect sqlDialect(FormatterProperties properties) {
        SqlDialect dialect = SqlDialect.forName(properties.sqlDialect());
        logger.info("Using SQL dialect '{}' ({} keywords, {} functions)",
                dialect.name(), dialect.keywords().size(), dialect.functions().size());
        return dialect;
    }

    @Bean
    public SqlFormatter sqlFormatter(SqlDialect dialect) {
        return new SqlFormatter(dialect);
    }

    @Bean
    public HtmlFormatter htmlFormatter() {
        return new HtmlFormatter();
    }
}
