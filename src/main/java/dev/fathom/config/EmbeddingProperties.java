package dev.fathom.config;

import jakarta.annotation.PostConstruct;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the embedding model.
 *
 * <p>Properties are bound from {@code fathom.embedding.*}.
 *
 * <ul>
 *   <li>{@code model} - model identifier: {@code bge-small-en-v15-q} (bundled, default) or {@code
 *       onnx} (custom ONNX model loaded from {@code model-path} and {@code tokenizer-path})
 *   <li>{@code batch-size} - maximum number of snippets embedded per model call (default 256)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "fathom.embedding")
public class EmbeddingProperties {

  public static final String BGE_SMALL_EN_V15_Q = "bge-small-en-v15-q";
  public static final String CUSTOM_ONNX = "onnx";

  private String model = BGE_SMALL_EN_V15_Q;
  private @Nullable String modelPath;
  private @Nullable String tokenizerPath;
  private int batchSize = 256;

  @PostConstruct
  void validate() {
    if (!BGE_SMALL_EN_V15_Q.equals(model) && !CUSTOM_ONNX.equals(model)) {
      throw new IllegalStateException(
          "fathom.embedding.model must be one of [%s, %s], got: %s"
              .formatted(BGE_SMALL_EN_V15_Q, CUSTOM_ONNX, model));
    }
    if (CUSTOM_ONNX.equals(model) && (modelPath == null || tokenizerPath == null)) {
      throw new IllegalStateException(
          "fathom.embedding.model-path and fathom.embedding.tokenizer-path are required for the onnx model");
    }
    if (batchSize < 1 || batchSize > 1024) {
      throw new IllegalStateException(
          "fathom.embedding.batch-size must be in [1, 1024], got: " + batchSize);
    }
  }

  public String getModel() {
    return model;
  }

  public void setModel(String model) {
    this.model = model;
  }

  public @Nullable String getModelPath() {
    return modelPath;
  }

  public void setModelPath(@Nullable String modelPath) {
    this.modelPath = modelPath;
  }

  public @Nullable String getTokenizerPath() {
    return tokenizerPath;
  }

  public void setTokenizerPath(@Nullable String tokenizerPath) {
    this.tokenizerPath = tokenizerPath;
  }

  public int getBatchSize() {
    return batchSize;
  }

  public void setBatchSize(int batchSize) {
    this.batchSize = batchSize;
  }
}
