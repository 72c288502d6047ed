package com.flamingo.ai.lifedigest.agent;

import com.flamingo.ai.lifedigest.agent.dto.TagsResult;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent that classifies file content with short descriptive tags. */
public interface TagsAgent {

  @SystemMessage(
      """
        You are an expert knowledge organizer. Extract short, descriptive tags that help
        classify the content.

        Tag format rules:
        - Use lowercase with spaces for multi-word tags (e.g., "open source", "machine learning")
        - Keep established spellings of proper nouns and technical terms (e.g., "iOS", "GitHub")
        - Prefer single words, use 2-3 word phrases only when needed for clarity
        - No hashtags, numbering, or punctuation
        - Between 5 and {{maxTags}} tags

        Return ONLY valid JSON matching this structure:
        {"tags": ["...", "..."]}
        """)
  @UserMessage("""
        Analyze the following content and produce tags.

        {{content}}
        """)
  TagsResult generateTags(@V("content") String content, @V("maxTags") int maxTags);
}
