package com.aiadvent.canvas.graph;

import java.util.List;

public record RetrievalConfig(
    String name,
    List<String> documents,
    int searchLimit,
    boolean enableBm25,
    int chunkSize,
    int chunkOverlap,
    String systemPrompt,
    String model,
    double temperature,
    int maxTokens,
    String embeddingProvider,
    String embeddingModel,
    List<OutputField> outputFields,
    String inputTemplate)
    implements NodeConfig {

  public static final int DEFAULT_SEARCH_LIMIT = 5;
  public static final int DEFAULT_CHUNK_SIZE = 500;
  public static final int DEFAULT_CHUNK_OVERLAP = 50;

  public RetrievalConfig {
    name = name != null ? name : "";
    documents = documents != null ? List.copyOf(documents) : List.of();
    model = model != null ? model : "";
    outputFields = outputFields != null ? List.copyOf(outputFields) : List.of();
  }

  @Override
  public NodeKind kind() {
    return NodeKind.RETRIEVAL;
  }

  @Override
  public <R> R accept(NodeConfigVisitor<R> visitor) {
    return visitor.visitRetrieval(this);
  }

  @Override
  public String displayName() {
    return name.isBlank() ? null : name;
  }
}
