package com.lumen.query.expansion;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(QueryExpansionProperties.class)
public class QueryExpansionConfig {

    @Bean
    public SynonymSource synonymSource(QueryExpansionProperties properties) {
        return ThesaurusSynonymSource.load(properties.getThesaurusPath());
    }

    @Bean
    public QueryExpander queryExpander(SynonymSource synonymSource, QueryExpansionProperties properties) {
        return new QueryExpander(synonymSource, properties);
    }
}
