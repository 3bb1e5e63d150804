package com.lumen.query.service;

import com.lumen.query.backend.KeywordBackend;
import com.lumen.query.backend.VectorBackend;
import com.lumen.query.embed.EmbeddingProvider;
import com.lumen.query.expansion.QueryExpander;
import com.lumen.query.metrics.QueryMetrics;
import com.lumen.query.ranking.RankingProperties;
import com.lumen.query.ranking.Reranker;
import com.lumen.query.resilience.ResilienceRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({QueryEngineProperties.class, QueryCacheProperties.class})
public class QueryEngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService searchExecutor(QueryEngineProperties properties) {
        // vector and keyword legs plus the embedding call run side by side
        return Executors.newFixedThreadPool(Math.max(3, properties.getPoolSize()));
    }

    @Bean
    public QueryMetrics queryMetrics(MeterRegistry meterRegistry) {
        return new QueryMetrics(meterRegistry);
    }

    @Bean
    public QueryResultCache queryResultCache(QueryCacheProperties properties, QueryMetrics queryMetrics, Clock clock) {
        return new QueryResultCache(properties, queryMetrics, clock);
    }

    @Bean
    public HybridQueryEngine hybridQueryEngine(
        QueryEngineProperties properties,
        RankingProperties rankingProperties,
        QueryResultCache resultCache,
        EmbeddingProvider embeddingProvider,
        VectorBackend vectorBackend,
        KeywordBackend keywordBackend,
        QueryExpander queryExpander,
        Reranker reranker,
        ResilienceRegistry resilienceRegistry,
        QueryMetrics queryMetrics,
        @Qualifier("searchExecutor") ExecutorService searchExecutor,
        Clock clock
    ) {
        return new HybridQueryEngine(
            properties,
            rankingProperties,
            resultCache,
            embeddingProvider,
            vectorBackend,
            keywordBackend,
            queryExpander,
            reranker,
            resilienceRegistry,
            queryMetrics,
            searchExecutor,
            clock
        );
    }
}
