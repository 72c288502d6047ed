package com.flamingo.ai.lifedigest.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent for plain-text summaries of crawled pages and transcripts.
 *
 * <p>Produces a 100-200 word summary of the main points.
 */
public interface SummaryAgent {

  @SystemMessage(
      """
        You are a summarization expert. Write a concise 100-200 word summary of the provided
        content, capturing its main points and essential information. Write in paragraph form
        and in the language of the content. Do not use markdown headers or bullet points.
        Do not start with "This document", "This page" or "The speaker".
        """)
  @UserMessage("""
        Source: {{source}}

        Content:
        {{content}}
        """)
  String summarize(@V("source") String source, @V("content") String content);
}
