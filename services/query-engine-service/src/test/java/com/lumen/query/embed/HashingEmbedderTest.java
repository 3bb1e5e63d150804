package com.lumen.query.embed;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class HashingEmbedderTest {

    private final HashingEmbedder embedder = new HashingEmbedder();

    @Test
    void producesUnitVectorsOfConfiguredDimension() {
        float[] vector = embedder.embed("machine learning basics");

        assertThat(vector).hasSize(HashingEmbedder.DEFAULT_DIMENSION);
        double norm = 0.0;
        for (float value : vector) {
            norm += value * value;
        }
        assertThat(Math.sqrt(norm)).isCloseTo(1.0, within(1e-5));
    }

    @Test
    void isDeterministicAndCaseInsensitive() {
        assertThat(embedder.embed("Machine Learning")).containsExactly(embedder.embed("machine learning"));
    }

    @Test
    void overlappingQueriesAreCloserThanUnrelatedOnes() {
        float[] base = embedder.embed("machine learning basics tutorial");
        float[] close = embedder.embed("machine learning basics guide");
        float[] far = embedder.embed("sourdough bread baking");

        assertThat(VectorMath.cosine(base, close)).isGreaterThan(VectorMath.cosine(base, far));
    }

    @Test
    void rejectsBlankText() {
        assertThatThrownBy(() -> embedder.embed("   "))
            .isInstanceOf(EmbeddingRequestException.class);
    }

    @Test
    void cachingProviderReusesVectorsForEquivalentText() {
        AtomicInteger calls = new AtomicInteger();
        CachingEmbeddingProvider provider = new CachingEmbeddingProvider(text -> {
            calls.incrementAndGet();
            return embedder.embed(text);
        }, 10);

        float[] first = provider.embed("Machine  Learning");
        first[0] = 42.0f;
        float[] second = provider.embed("machine learning");

        assertThat(calls.get()).isEqualTo(1);
        assertThat(second[0]).isNotEqualTo(42.0f);
        assertThat(provider.stats().getHits()).isEqualTo(1);
    }
}
