package dev.fathom.config;

import dev.fathom.vector.CollectionNames;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.OnnxEmbeddingModel;
import dev.langchain4j.model.embedding.onnx.PoolingMode;
import dev.langchain4j.model.embedding.onnx.bgesmallenv15q.BgeSmallEnV15QuantizedEmbeddingModel;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configures the embedding model used for both snippet indexing and semantic queries.
 *
 * <p>By default the ONNX-based bge-small-en-v1.5 quantized model (384 dimensions) runs in-process,
 * avoiding any external embedding API. A custom ONNX model can be selected with {@code
 * fathom.embedding.model=onnx}; its dimension then drives the size of the pgvector collections.
 *
 * @see dev.fathom.vector.PgVectorCollectionStore
 */
@Configuration
public class EmbeddingConfig {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingConfig.class);

    /**
     * Provides the embedding model selected by {@code fathom.embedding.model}.
     *
     * @param properties validated embedding properties
     * @return a ready-to-use in-process embedding model
     */
    @Bean
    public EmbeddingModel embeddingModel(EmbeddingProperties properties) {
        log.info("Loading embedding model: {}", properties.getModel());
        if (EmbeddingProperties.CUSTOM_ONNX.equals(properties.getModel())) {
            return new OnnxEmbeddingModel(
                    Objects.requireNonNull(properties.getModelPath()),
                    Objects.requireNonNull(properties.getTokenizerPath()),
                    PoolingMode.MEAN);
        }
        return new BgeSmallEnV15QuantizedEmbeddingModel();
    }

    /**
     * Provides the collection naming scheme shared by indexing and semantic queries.
     *
     * @param prefix leading part of every collection name
     * @return naming scheme for per-project snippet collections
     */
    @Bean
    public CollectionNames collectionNames(
            @Value("${fathom.vector.collection-prefix:fathom_snippets}") String prefix) {
        return new CollectionNames(prefix);
    }
}
