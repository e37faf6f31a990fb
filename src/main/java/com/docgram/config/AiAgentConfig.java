package com.docgram.config;

import com.docgram.agent.PostAnswerAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for AI agents built with LangChain4j AI Services.
 *
 * <p>Agent interfaces declare their prompts with @SystemMessage/@UserMessage; implementations are
 * generated by AiServices.builder().
 */
@Configuration
public class AiAgentConfig {

  @Bean
  public PostAnswerAgent postAnswerAgent(ChatModel chatModel) {
    return AiServices.builder(PostAnswerAgent.class).chatModel(chatModel).build();
  }
}
