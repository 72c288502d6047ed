package com.flamingo.ai.lifedigest.config;

import com.flamingo.ai.lifedigest.agent.SummaryAgent;
import com.flamingo.ai.lifedigest.agent.TagsAgent;
import com.flamingo.ai.lifedigest.agent.TranscriptCleanupAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for digest AI agents using LangChain4j AI Services.
 *
 * <p>Agents are interfaces with @SystemMessage/@UserMessage prompts, implemented by
 * AiServices.builder().
 */
@Configuration
public class AiAgentConfig {

  /** Tags agent. Uses the JSON-mode chatModel for structured output. */
  @Bean
  public TagsAgent tagsAgent(@Qualifier("chatModel") ChatModel chatModel) {
    return AiServices.builder(TagsAgent.class).chatModel(chatModel).build();
  }

  /** Summary agent. Uses textChatModel (no JSON response format) for free-form text. */
  @Bean
  public SummaryAgent summaryAgent(@Qualifier("textChatModel") ChatModel textChatModel) {
    return AiServices.builder(SummaryAgent.class).chatModel(textChatModel).build();
  }

  @Bean
  public TranscriptCleanupAgent transcriptCleanupAgent(
      @Qualifier("textChatModel") ChatModel textChatModel) {
    return AiServices.builder(TranscriptCleanupAgent.class).chatModel(textChatModel).build();
  }
}
