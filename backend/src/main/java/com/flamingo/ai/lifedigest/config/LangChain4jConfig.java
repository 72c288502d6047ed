package com.flamingo.ai.lifedigest.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * OpenAI-compatible models used by the digesters. All of them share one endpoint and key, so a
 * local gateway can be swapped in through {@code langchain4j.openai.base-url}.
 */
@Configuration
public class LangChain4jConfig {

  private static final String JSON_OBJECT = "json_object";

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.base-url:https://api.openai.com/v1}")
  private String baseUrl;

  @Value("${langchain4j.openai.log-requests:false}")
  private boolean logRequests;

  @Value("${langchain4j.openai.chat-model.model-name:gpt-5-mini}")
  private String chatModelName;

  @Value("${langchain4j.openai.chat-model.max-completion-tokens:2048}")
  private int maxCompletionTokens;

  /** Summaries and cleaned transcripts are long; they get a larger completion budget. */
  @Value("${langchain4j.openai.chat-model.text-max-completion-tokens:8192}")
  private int textMaxCompletionTokens;

  @Value("${langchain4j.openai.vision-model.model-name:gpt-4.1-mini}")
  private String visionModelName;

  @Value("${langchain4j.openai.embedding-model.model-name:text-embedding-3-small}")
  private String embeddingModelName;

  @Value("${langchain4j.openai.embedding-model.dimensions:1536}")
  private int embeddingDimensions;

  /** JSON-mode model for structured agent output (tags). */
  @Bean
  @Primary
  public ChatModel chatModel() {
    return chat(chatModelName, Duration.ofSeconds(60))
        .maxCompletionTokens(maxCompletionTokens)
        .responseFormat(JSON_OBJECT)
        .build();
  }

  /** Free-form text model for summaries and transcript cleanup. */
  @Bean
  public ChatModel textChatModel() {
    return chat(chatModelName, Duration.ofSeconds(180))
        .maxCompletionTokens(textMaxCompletionTokens)
        .build();
  }

  /** Multimodal model for object detection; answers in JSON. */
  @Bean
  public ChatModel visionChatModel() {
    return chat(visionModelName, Duration.ofSeconds(120))
        .temperature(0.3)
        .responseFormat(JSON_OBJECT)
        .build();
  }

  @Bean
  public EmbeddingModel embeddingModel() {
    return OpenAiEmbeddingModel.builder()
        .apiKey(requireApiKey())
        .baseUrl(baseUrl)
        .modelName(embeddingModelName)
        .dimensions(embeddingDimensions)
        .timeout(Duration.ofSeconds(30))
        .build();
  }

  private OpenAiChatModel.OpenAiChatModelBuilder chat(String modelName, Duration timeout) {
    return OpenAiChatModel.builder()
        .apiKey(requireApiKey())
        .baseUrl(baseUrl)
        .modelName(modelName)
        .timeout(timeout)
        .logRequests(logRequests)
        .logResponses(logRequests);
  }

  private String requireApiKey() {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required. Set the OPENAI_API_KEY environment variable.");
    }
    return openAiApiKey;
  }
}
