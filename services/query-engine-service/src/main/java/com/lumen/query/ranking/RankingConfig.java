package com.lumen.query.ranking;

import com.lumen.query.metrics.QueryMetrics;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
@EnableConfigurationProperties(RankingProperties.class)
public class RankingConfig {

    @Bean
    public RestTemplate rankingRestTemplate(RestTemplateBuilder builder, RankingProperties properties) {
        return builder
            .setConnectTimeout(Duration.ofMillis(properties.getTimeoutMs()))
            .setReadTimeout(Duration.ofMillis(properties.getTimeoutMs()))
            .build();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService rerankExecutor(RankingProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getPoolSize()));
    }

    @Bean
    public PairwiseRelevanceModel pairwiseRelevanceModel(
        @Qualifier("rankingRestTemplate") RestTemplate restTemplate,
        RankingProperties properties
    ) {
        if (properties.getMode() == RankingProperties.RankingMode.REMOTE) {
            return new RankingGateway(restTemplate, properties);
        }
        return new LexicalRelevanceModel();
    }

    @Bean
    public Reranker reranker(
        PairwiseRelevanceModel model,
        @Qualifier("rerankExecutor") ExecutorService rerankExecutor,
        RankingProperties properties,
        QueryMetrics queryMetrics
    ) {
        return new Reranker(model, rerankExecutor, properties, queryMetrics);
    }
}
